package io.pincer.host.push;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.pincer.api.context.PageContext;
import io.pincer.host.registry.ContextListener;
import io.pincer.host.registry.TabConnection;

/**
 * Forwards a summary of every context change to the sink. Repeated updates with an unchanged url,
 * title and selection are not forwarded again.
 */
public class ContextPushListener implements ContextListener {
   private static final Logger log = LogManager.getLogger(ContextPushListener.class);

   private final SystemEventSink sink;
   private String lastSummary;
   private String lastConnectionId;

   public ContextPushListener(SystemEventSink sink) {
      this.sink = sink;
   }

   @Override
   public void onContextUpdate(TabConnection connection, PageContext context) {
      String summary = ContextSummary.format(context);
      synchronized (this) {
         if (summary.equals(lastSummary) && connection.id().equals(lastConnectionId)) {
            return;
         }
         lastSummary = summary;
         lastConnectionId = connection.id();
      }
      log.trace("Pushing context of {}", connection.id());
      sink.publish(connection.id(), summary);
   }
}
