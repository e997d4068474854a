package io.pincer.host;

import java.util.function.LongSupplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.pincer.api.context.PageContext;
import io.pincer.api.protocol.EventEnvelope;
import io.pincer.api.protocol.JsonFields;
import io.pincer.api.protocol.MalformedMessageException;
import io.pincer.api.protocol.UnknownMessageTypeException;
import io.pincer.host.registry.ConnectionRegistry;
import io.pincer.host.registry.TabConnection;
import io.vertx.core.Handler;
import io.vertx.core.http.ServerWebSocket;
import io.vertx.core.json.JsonObject;

/**
 * Accepts tab sockets. Each socket gets a fresh connection id and is registered immediately; its
 * tab id is bound by the first upstream message that carries one.
 */
public class PincerSocketHandler implements Handler<ServerWebSocket> {
   private static final Logger log = LogManager.getLogger(PincerSocketHandler.class);
   private static final int SELECTION_LOG_LENGTH = 50;

   private final ConnectionRegistry registry;
   private final LongSupplier clock;

   public PincerSocketHandler(ConnectionRegistry registry) {
      this(registry, System::currentTimeMillis);
   }

   PincerSocketHandler(ConnectionRegistry registry, LongSupplier clock) {
      this.registry = registry;
      this.clock = clock;
   }

   @Override
   public void handle(ServerWebSocket webSocket) {
      String connectionId = ConnectionIds.next();
      log.info("New connection: {} from {}", connectionId, webSocket.remoteAddress());
      registry.add(new TabConnection(connectionId, null, "", "", new WebSocketTabSocket(webSocket), clock.getAsLong()));

      webSocket.textMessageHandler(frame -> handleFrame(connectionId, frame));
      webSocket.binaryMessageHandler(buffer ->
            log.debug("Dropping binary frame ({} bytes) from {}", buffer.length(), connectionId));
      webSocket.closeHandler(nil -> {
         log.info("Connection closed: {}", connectionId);
         registry.remove(connectionId);
      });
      webSocket.exceptionHandler(t -> {
         log.error("WebSocket error on " + connectionId, t);
         registry.remove(connectionId);
      });
   }

   void handleFrame(String connectionId, String frame) {
      EventEnvelope event;
      try {
         event = EventEnvelope.decode(frame);
      } catch (UnknownMessageTypeException e) {
         log.debug("Unknown message type {} from {}", e.type(), connectionId);
         return;
      } catch (MalformedMessageException e) {
         log.error("Invalid message from {}: {}", connectionId, e.getMessage());
         return;
      }
      handleEvent(connectionId, event);
   }

   void handleEvent(String connectionId, EventEnvelope event) {
      if (event.tabId() != null) {
         registry.bindTab(connectionId, event.tabId(), event.url());
      }
      registry.touch(connectionId);

      switch (event.type()) {
         case CONNECT:
            log.info("Tab {} connected: {}", event.tabId(), event.url());
            break;
         case DISCONNECT:
            registry.remove(connectionId);
            break;
         case PAGE_CONTEXT:
            handlePageContext(connectionId, event);
            break;
         case SELECTION:
            handleSelection(connectionId, event);
            break;
         case COMMAND_RESULT:
            if (event.requestId() == null) {
               log.warn("Command result without requestId from {}", connectionId);
            } else {
               registry.resolveCommand(connectionId, event.requestId(), event.payload());
            }
            break;
         case SCREENSHOT:
            log.debug("Screenshot received from tab {}", event.tabId());
            break;
         case DOM_SNAPSHOT:
            log.debug("DOM snapshot received from tab {}", event.tabId());
            break;
         case CLICK_EVENT:
         case SCROLL_EVENT:
            log.debug("{} received from tab {}", event.type().wireName(), event.tabId());
            break;
         default:
            throw new IllegalStateException("Unhandled event type " + event.type());
      }
   }

   private void handlePageContext(String connectionId, EventEnvelope event) {
      PageContext context;
      try {
         context = PageContext.fromJson(event.payloadObject());
      } catch (MalformedMessageException e) {
         log.error("Invalid page context from {}: {}", connectionId, e.getMessage());
         return;
      }
      registry.updateContext(connectionId, context.withTimestamp(clock.getAsLong()));
      log.debug("Context updated: {}", context.url());
   }

   private void handleSelection(String connectionId, EventEnvelope event) {
      JsonObject payload = event.payloadObject();
      Object text = payload == null ? null : payload.getValue("text");
      if (registry.get(connectionId) != null && text instanceof String && !((String) text).isEmpty()) {
         log.debug("Selection: \"{}\"", JsonFields.abbreviate((String) text, SELECTION_LOG_LENGTH));
      }
   }
}
