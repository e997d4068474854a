package io.pincer.api.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.pincer.api.protocol.JsonFields;
import io.pincer.api.protocol.MalformedMessageException;
import io.pincer.internal.Properties;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * Settings of the tab side. The JSON form matches what the extension keeps in its local storage:
 * <pre>
 * {
 *   "gateway": { "url": "ws://localhost:18789/pincer", "token": "..." },
 *   "autoConnect": true,
 *   "sendOnTabSwitch": true,
 *   "allowedDomains": [...],
 *   "blockedDomains": [...],
 *   "reconnect": { "maxAttempts": 5, "baseDelay": 1000 }
 * }
 * </pre>
 * Domain lists are advisory: the content capture layer enforces them, this library only carries them.
 */
public final class ExtensionConfig {
   public static final String DEFAULT_GATEWAY_URL = "ws://localhost:18789/pincer";
   public static final int DEFAULT_RECONNECT_MAX_ATTEMPTS = 5;
   public static final long DEFAULT_RECONNECT_BASE_DELAY = 1000;

   public static final ExtensionConfig DEFAULT = new ExtensionConfig(DEFAULT_GATEWAY_URL, null, true, true,
         Collections.emptyList(), Collections.emptyList(), DEFAULT_RECONNECT_MAX_ATTEMPTS, DEFAULT_RECONNECT_BASE_DELAY);

   private final String gatewayUrl;
   private final String token;
   private final boolean autoConnect;
   private final boolean sendOnTabSwitch;
   private final List<String> allowedDomains;
   private final List<String> blockedDomains;
   private final int reconnectMaxAttempts;
   private final long reconnectBaseDelay;

   public ExtensionConfig(String gatewayUrl, String token, boolean autoConnect, boolean sendOnTabSwitch,
                          List<String> allowedDomains, List<String> blockedDomains,
                          int reconnectMaxAttempts, long reconnectBaseDelay) {
      if (gatewayUrl == null || gatewayUrl.isEmpty()) {
         throw new IllegalArgumentException("Gateway URL must be set");
      }
      if (reconnectMaxAttempts < 0 || reconnectBaseDelay <= 0) {
         throw new IllegalArgumentException("Invalid reconnect policy: " + reconnectMaxAttempts + " attempts, "
               + reconnectBaseDelay + " ms base delay");
      }
      this.gatewayUrl = gatewayUrl;
      this.token = token == null || token.isEmpty() ? null : token;
      this.autoConnect = autoConnect;
      this.sendOnTabSwitch = sendOnTabSwitch;
      this.allowedDomains = List.copyOf(allowedDomains);
      this.blockedDomains = List.copyOf(blockedDomains);
      this.reconnectMaxAttempts = reconnectMaxAttempts;
      this.reconnectBaseDelay = reconnectBaseDelay;
   }

   /**
    * Defaults overridden by system properties or environment variables.
    */
   public static ExtensionConfig fromProperties() {
      return new ExtensionConfig(
            Properties.get(Properties.GATEWAY_URL, DEFAULT_GATEWAY_URL),
            Properties.get(Properties.GATEWAY_TOKEN, null),
            Properties.getBoolean(Properties.AUTO_CONNECT, true),
            Properties.getBoolean(Properties.SEND_ON_TAB_SWITCH, true),
            Collections.emptyList(), Collections.emptyList(),
            Properties.getInt(Properties.RECONNECT_MAX_ATTEMPTS, DEFAULT_RECONNECT_MAX_ATTEMPTS),
            Properties.getLong(Properties.RECONNECT_BASE_DELAY, DEFAULT_RECONNECT_BASE_DELAY));
   }

   public static ExtensionConfig fromJson(JsonObject json) {
      return DEFAULT.merge(json);
   }

   /**
    * Applies a partial update; fields absent from {@code update} keep their current value. A field
    * of the wrong type fails the whole update with {@link MalformedMessageException} and this
    * instance stays as it was.
    */
   public ExtensionConfig merge(JsonObject update) {
      if (update == null || update.isEmpty()) {
         return this;
      }
      String url = gatewayUrl;
      String newToken = token;
      JsonObject gateway = JsonFields.object(update, "gateway");
      if (gateway != null) {
         url = orElse(JsonFields.string(gateway, "url"), url);
         if (gateway.containsKey("token")) {
            newToken = JsonFields.string(gateway, "token");
         }
      }
      int maxAttempts = reconnectMaxAttempts;
      long baseDelay = reconnectBaseDelay;
      JsonObject reconnect = JsonFields.object(update, "reconnect");
      if (reconnect != null) {
         maxAttempts = orElse(JsonFields.integer(reconnect, "maxAttempts"), maxAttempts);
         baseDelay = orElse(JsonFields.longInteger(reconnect, "baseDelay"), baseDelay);
      }
      return new ExtensionConfig(url, newToken,
            orElse(JsonFields.bool(update, "autoConnect"), autoConnect),
            orElse(JsonFields.bool(update, "sendOnTabSwitch"), sendOnTabSwitch),
            domains(JsonFields.array(update, "allowedDomains"), allowedDomains),
            domains(JsonFields.array(update, "blockedDomains"), blockedDomains),
            maxAttempts, baseDelay);
   }

   private static <T> T orElse(T value, T current) {
      return value == null ? current : value;
   }

   private static List<String> domains(JsonArray array, List<String> current) {
      if (array == null) {
         return current;
      }
      List<String> list = new ArrayList<>(array.size());
      for (Object item : array) {
         if (item != null) {
            list.add(item.toString());
         }
      }
      return list;
   }

   public String gatewayUrl() {
      return gatewayUrl;
   }

   public String token() {
      return token;
   }

   public boolean autoConnect() {
      return autoConnect;
   }

   public boolean sendOnTabSwitch() {
      return sendOnTabSwitch;
   }

   public List<String> allowedDomains() {
      return allowedDomains;
   }

   public List<String> blockedDomains() {
      return blockedDomains;
   }

   public int reconnectMaxAttempts() {
      return reconnectMaxAttempts;
   }

   public long reconnectBaseDelay() {
      return reconnectBaseDelay;
   }

   public JsonObject toJson() {
      JsonObject gateway = new JsonObject().put("url", gatewayUrl);
      if (token != null) {
         gateway.put("token", token);
      }
      return new JsonObject()
            .put("gateway", gateway)
            .put("autoConnect", autoConnect)
            .put("sendOnTabSwitch", sendOnTabSwitch)
            .put("allowedDomains", new JsonArray(new ArrayList<>(allowedDomains)))
            .put("blockedDomains", new JsonArray(new ArrayList<>(blockedDomains)))
            .put("reconnect", new JsonObject().put("maxAttempts", reconnectMaxAttempts).put("baseDelay", reconnectBaseDelay));
   }

   @Override
   public String toString() {
      // token is never logged
      return "ExtensionConfig{gateway=" + gatewayUrl + ", autoConnect=" + autoConnect + ", sendOnTabSwitch="
            + sendOnTabSwitch + ", reconnect=" + reconnectMaxAttempts + "x" + reconnectBaseDelay + "ms}";
   }
}
