package io.pincer.host;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import io.pincer.api.connection.ConnectionNotFoundException;
import io.pincer.api.context.PageContext;
import io.pincer.api.protocol.CommandEnvelope;
import io.pincer.api.protocol.CommandType;
import io.pincer.api.protocol.MalformedMessageException;
import io.pincer.host.registry.ConnectionRegistry;
import io.pincer.host.registry.TabConnection;
import io.vertx.core.Future;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * Entry point for the command-issuing layer (e.g. assistant tools). Commands target an explicit
 * connection or, when none is given, the most recently active one.
 */
public class TabCommandService {
   static final String ACTIVE = "<active>";

   private final ConnectionRegistry registry;
   private final AtomicLong requestIds = new AtomicLong();

   public TabCommandService(ConnectionRegistry registry) {
      this.registry = registry;
   }

   public TabConnection target(String connectionId) {
      return connectionId == null ? registry.getActive() : registry.get(connectionId);
   }

   public Future<Object> send(String connectionId, CommandType type) {
      return send(connectionId, type, builder -> {
      });
   }

   public Future<Object> send(String connectionId, CommandType type, Consumer<CommandEnvelope.Builder> customizer) {
      TabConnection target = target(connectionId);
      if (target == null) {
         return Future.failedFuture(new ConnectionNotFoundException(connectionId == null ? ACTIVE : connectionId));
      }
      CommandEnvelope.Builder builder = CommandEnvelope.builder(type, nextRequestId(type)).tabId(target.tabId());
      customizer.accept(builder);
      return registry.sendCommand(target.id(), builder.build());
   }

   /**
    * Returns the cached context unless {@code refresh} is set or nothing is cached yet, in which
    * case the tab is asked for a fresh one.
    */
   public Future<PageContext> context(String connectionId, boolean refresh) {
      TabConnection target = target(connectionId);
      if (target == null) {
         return Future.failedFuture(new ConnectionNotFoundException(connectionId == null ? ACTIVE : connectionId));
      }
      if (!refresh && target.context() != null) {
         return Future.succeededFuture(target.context());
      }
      return send(target.id(), CommandType.GET_CONTEXT).compose(result -> {
         if (!(result instanceof JsonObject)) {
            return Future.failedFuture(new MalformedMessageException("Context result is not an object: " + result));
         }
         PageContext context = PageContext.fromJson((JsonObject) result).withTimestamp(System.currentTimeMillis());
         registry.updateContext(target.id(), context);
         return Future.succeededFuture(context);
      });
   }

   public JsonArray describeTabs() {
      JsonArray tabs = new JsonArray();
      for (TabConnection connection : registry.list()) {
         tabs.add(connection.toJson());
      }
      return tabs;
   }

   private String nextRequestId(CommandType type) {
      return type.wireName() + "-" + requestIds.incrementAndGet();
   }
}
