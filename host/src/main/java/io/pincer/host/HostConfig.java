package io.pincer.host;

import java.util.function.Function;

import io.pincer.internal.Properties;
import io.vertx.core.json.JsonObject;

/**
 * Host settings, resolved from system properties, environment, the verticle config and defaults,
 * in that order.
 */
public final class HostConfig {
   public static final String DEFAULT_HOST = "0.0.0.0";
   public static final int DEFAULT_PORT = 18789;
   public static final String DEFAULT_WS_PATH = "/pincer";
   public static final long DEFAULT_REQUEST_TIMEOUT = 30000;

   private final boolean enabled;
   private final String host;
   private final int port;
   private final String wsPath;
   private final long requestTimeout;
   private final boolean pushContextOnSwitch;

   public HostConfig(boolean enabled, String host, int port, String wsPath, long requestTimeout, boolean pushContextOnSwitch) {
      if (wsPath == null || !wsPath.startsWith("/")) {
         throw new IllegalArgumentException("WebSocket path must start with '/': " + wsPath);
      }
      if (requestTimeout <= 0) {
         throw new IllegalArgumentException("Request timeout must be positive: " + requestTimeout);
      }
      this.enabled = enabled;
      this.host = host;
      this.port = port;
      this.wsPath = wsPath.length() > 1 && wsPath.endsWith("/") ? wsPath.substring(0, wsPath.length() - 1) : wsPath;
      this.requestTimeout = requestTimeout;
      this.pushContextOnSwitch = pushContextOnSwitch;
   }

   public static HostConfig defaults() {
      return from(new JsonObject());
   }

   public static HostConfig from(JsonObject config) {
      return new HostConfig(
            Properties.get(Properties.ENABLED, config, Boolean::valueOf, true),
            Properties.get(Properties.HOST, config, Function.identity(), DEFAULT_HOST),
            Properties.get(Properties.PORT, config, Integer::valueOf, DEFAULT_PORT),
            Properties.get(Properties.WS_PATH, config, Function.identity(), DEFAULT_WS_PATH),
            Properties.get(Properties.REQUEST_TIMEOUT, config, Long::valueOf, DEFAULT_REQUEST_TIMEOUT),
            Properties.get(Properties.PUSH_CONTEXT_ON_SWITCH, config, Boolean::valueOf, true));
   }

   public boolean enabled() {
      return enabled;
   }

   public String host() {
      return host;
   }

   public int port() {
      return port;
   }

   public String wsPath() {
      return wsPath;
   }

   public long requestTimeout() {
      return requestTimeout;
   }

   public boolean pushContextOnSwitch() {
      return pushContextOnSwitch;
   }

   @Override
   public String toString() {
      return "HostConfig{" + host + ":" + port + wsPath + ", requestTimeout=" + requestTimeout
            + ", pushContextOnSwitch=" + pushContextOnSwitch + (enabled ? "" : ", disabled") + "}";
   }
}
