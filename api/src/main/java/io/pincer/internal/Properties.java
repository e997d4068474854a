package io.pincer.internal;

import java.util.function.Function;

import io.vertx.core.json.JsonObject;

public interface Properties {
   String ENABLED = "io.pincer.enabled";
   String HOST = "io.pincer.host";
   String PORT = "io.pincer.port";
   String WS_PATH = "io.pincer.ws.path";
   String REQUEST_TIMEOUT = "io.pincer.request.timeout";
   String PUSH_CONTEXT_ON_SWITCH = "io.pincer.push.context.on.switch";
   String GATEWAY_URL = "io.pincer.gateway.url";
   String GATEWAY_TOKEN = "io.pincer.gateway.token";
   String AUTO_CONNECT = "io.pincer.auto.connect";
   String SEND_ON_TAB_SWITCH = "io.pincer.send.on.tab.switch";
   String RECONNECT_MAX_ATTEMPTS = "io.pincer.reconnect.max.attempts";
   String RECONNECT_BASE_DELAY = "io.pincer.reconnect.base.delay";

   static String get(String property, String def) {
      return get(property, Function.identity(), def);
   }

   static long getLong(String property, long def) {
      return get(property, Long::valueOf, def);
   }

   static int getInt(String property, int def) {
      return get(property, Integer::valueOf, def);
   }

   static boolean getBoolean(String property, boolean def) {
      return get(property, Boolean::valueOf, def);
   }

   static <T> T get(String property, Function<String, T> f, T def) {
      String value = System.getProperty(property);
      if (value != null) {
         return f.apply(value);
      }
      value = System.getenv(property.replaceAll("[^a-zA-Z0-9]", "_").toUpperCase());
      if (value != null) {
         return f.apply(value);
      }
      return def;
   }

   /**
    * System properties and environment win over the verticle config, which wins over the default.
    */
   static <T> T get(String property, JsonObject config, Function<String, T> f, T def) {
      Object configured = config == null ? null : config.getValue(property);
      return get(property, f, configured == null ? def : f.apply(String.valueOf(configured)));
   }
}
