package io.pincer.client.bridge;

import io.pincer.api.context.PageContext;
import io.pincer.api.protocol.CommandEnvelope;
import io.vertx.core.Future;

/**
 * Access to the content layer of the browser: the tabs themselves and the script running in them.
 */
public interface TabDriver {
   /**
    * @return id of the focused tab, or a future completed with {@code null} when there is none.
    */
   Future<Integer> activeTabId();

   Future<PageContext> requestContext(int tabId);

   /**
    * Performs the command in the given tab. The result becomes the {@code payload} of the
    * {@code command_result} sent back to the host.
    */
   Future<Object> execute(int tabId, CommandEnvelope command);
}
