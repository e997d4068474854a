package io.pincer.client.bridge;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.pincer.api.config.ExtensionConfig;
import io.pincer.api.connection.ConnectionState;
import io.pincer.api.context.PageContext;
import io.pincer.api.protocol.CommandEnvelope;
import io.pincer.api.protocol.EventEnvelope;
import io.pincer.api.protocol.EventType;
import io.pincer.client.ConnectionListener;
import io.pincer.client.Gateway;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;

/**
 * Browser-side coordinator. Owns the single {@link Gateway} of the browser, keeps track of the
 * tabs it has seen and moves messages between the gateway and the {@link TabDriver}.
 */
public class ExtensionBridge implements ConnectionListener {
   private static final Logger log = LogManager.getLogger(ExtensionBridge.class);
   private static final String INTERNAL_PAGE_PREFIX = "chrome://";

   private final TabDriver driver;
   private final Gateway gateway;
   private final Map<Integer, TabInfo> tabs = new LinkedHashMap<>();
   private final List<StatusListener> statusListeners = new CopyOnWriteArrayList<>();
   private volatile ExtensionConfig config;

   public ExtensionBridge(ExtensionConfig config, TabDriver driver, Gateway.Factory gatewayFactory) {
      this.config = config;
      this.driver = driver;
      this.gateway = gatewayFactory.create(config, this);
   }

   public void start() {
      if (config.autoConnect()) {
         gateway.connect();
      }
      log.info("Bridge started with {}", config);
   }

   public void connect() {
      gateway.connect();
   }

   public void disconnect() {
      gateway.disconnect();
   }

   public void addStatusListener(StatusListener listener) {
      statusListeners.add(listener);
   }

   public ConnectionState status() {
      return gateway.state();
   }

   public int tabCount() {
      synchronized (tabs) {
         return tabs.size();
      }
   }

   public List<TabInfo> tabs() {
      synchronized (tabs) {
         return new ArrayList<>(tabs.values());
      }
   }

   public ExtensionConfig config() {
      return config;
   }

   /**
    * Applies a partial configuration update. The new values are used by the next connection
    * attempt.
    *
    * @throws io.pincer.api.protocol.MalformedMessageException if a field has the wrong type; the
    *         current configuration is kept.
    */
   public ExtensionConfig updateConfig(JsonObject update) {
      ExtensionConfig updated;
      synchronized (this) {
         updated = config.merge(update);
         config = updated;
      }
      gateway.updateConfig(updated);
      return updated;
   }

   public JsonObject statusJson() {
      return new JsonObject()
            .put("status", status().label())
            .put("tabCount", tabCount())
            .put("config", config.toJson().put("gateway", new JsonObject().put("url", config.gatewayUrl())));
   }

   public void onTabActivated(int tabId, String url, String title) {
      if (url == null || url.startsWith(INTERNAL_PAGE_PREFIX)) {
         return;
      }
      synchronized (tabs) {
         tabs.put(tabId, new TabInfo(tabId, url, title));
      }
      if (config.sendOnTabSwitch() && gateway.state() == ConnectionState.CONNECTED) {
         requestContext(tabId);
      }
   }

   /**
    * Records the new url and title of a tab once it has finished loading.
    */
   public void onTabUpdated(int tabId, String url, String title, boolean complete) {
      if (!complete || url == null) {
         return;
      }
      synchronized (tabs) {
         tabs.put(tabId, new TabInfo(tabId, url, title));
      }
   }

   public void onTabRemoved(int tabId) {
      synchronized (tabs) {
         tabs.remove(tabId);
      }
   }

   /**
    * Context pushed by the content layer of a tab.
    */
   public boolean publishContext(int tabId, String url, PageContext context) {
      if (gateway.state() != ConnectionState.CONNECTED) {
         return false;
      }
      return gateway.send(EventEnvelope.of(EventType.PAGE_CONTEXT, tabId, url, context.toJson()));
   }

   public boolean publishSelection(int tabId, String url, String text) {
      if (gateway.state() != ConnectionState.CONNECTED) {
         return false;
      }
      return gateway.send(EventEnvelope.of(EventType.SELECTION, tabId, url, new JsonObject().put("text", text)));
   }

   private void requestContext(int tabId) {
      driver.requestContext(tabId).onComplete(result -> {
         if (result.failed()) {
            // content script is not injected in every tab
            log.debug("Could not get context from tab {}: {}", tabId, result.cause().getMessage());
         } else if (result.result() != null) {
            PageContext context = result.result();
            gateway.send(EventEnvelope.of(EventType.PAGE_CONTEXT, tabId, context.url(), context.toJson()));
         }
      });
   }

   @Override
   public void onStatusChange(ConnectionState state) {
      int tabCount = tabCount();
      for (StatusListener listener : statusListeners) {
         try {
            listener.onStatus(state, tabCount);
         } catch (Throwable t) {
            log.error("Status listener failed", t);
         }
      }
   }

   @Override
   public void onError(Throwable error) {
      log.error("Connection error: {}", error.getMessage());
   }

   @Override
   public void onCommand(CommandEnvelope command) {
      log.debug("Received command {}", command);
      if (command.type().isRejectedByPolicy()) {
         log.warn("Rejecting {}: disabled by policy", command);
         reply(command.tabId(), command.requestId(), error(command.type().wireName() + " is disabled"));
         return;
      }
      Future<Integer> target = command.tabId() != null ? Future.succeededFuture(command.tabId()) : driver.activeTabId();
      target.onComplete(tab -> {
         if (tab.failed() || tab.result() == null) {
            log.warn("No active tab for {}", command);
            reply(null, command.requestId(), error("No active tab"));
            return;
         }
         int tabId = tab.result();
         driver.execute(tabId, command).onComplete(result -> {
            if (result.failed()) {
               log.error("Failed to execute " + command, result.cause());
               reply(tabId, command.requestId(), error(String.valueOf(result.cause().getMessage())));
            } else if (result.result() == null) {
               reply(tabId, command.requestId(), error("No response from tab"));
            } else {
               reply(tabId, command.requestId(), result.result());
            }
         });
      });
   }

   private void reply(Integer tabId, String requestId, Object payload) {
      String url;
      synchronized (tabs) {
         TabInfo info = tabId == null ? null : tabs.get(tabId);
         url = info == null ? "" : info.url();
      }
      if (!gateway.send(EventEnvelope.commandResult(tabId, url, requestId, payload))) {
         log.warn("Result of {} dropped, gateway is {}", requestId, gateway.state().label());
      }
   }

   private static JsonObject error(String message) {
      return new JsonObject().put("ok", false).put("error", message);
   }
}
