package io.pincer.api.protocol;

import java.util.Objects;

import io.vertx.core.json.JsonObject;

/**
 * Upstream message: {@code {type, tabId, url, timestamp, requestId?, payload}}.
 * <p>
 * The payload is opaque to the bridge; it is kept as decoded by Vert.x (a {@link JsonObject},
 * {@link io.vertx.core.json.JsonArray}, string, number, boolean or {@code null}).
 */
public final class EventEnvelope {
   private final EventType type;
   private final Integer tabId;
   private final String url;
   private final long timestamp;
   private final String requestId;
   private final Object payload;

   public EventEnvelope(EventType type, Integer tabId, String url, long timestamp, String requestId, Object payload) {
      this.type = Objects.requireNonNull(type);
      this.tabId = tabId;
      this.url = url;
      this.timestamp = timestamp;
      this.requestId = requestId;
      this.payload = payload;
   }

   public static EventEnvelope of(EventType type, Integer tabId, String url, Object payload) {
      return new EventEnvelope(type, tabId, url, System.currentTimeMillis(), null, payload);
   }

   public static EventEnvelope commandResult(Integer tabId, String url, String requestId, Object payload) {
      return new EventEnvelope(EventType.COMMAND_RESULT, tabId, url, System.currentTimeMillis(),
            Objects.requireNonNull(requestId), payload);
   }

   public static EventEnvelope decode(String text) {
      return fromJson(JsonFields.parse(text));
   }

   public static EventEnvelope fromJson(JsonObject json) {
      EventType type = EventType.fromWireName(JsonFields.requiredString(json, "type"));
      Number timestamp = JsonFields.number(json, "timestamp");
      return new EventEnvelope(type,
            JsonFields.integer(json, "tabId"),
            JsonFields.string(json, "url"),
            timestamp == null ? 0 : timestamp.longValue(),
            JsonFields.string(json, "requestId"),
            json.getValue("payload"));
   }

   public EventType type() {
      return type;
   }

   public Integer tabId() {
      return tabId;
   }

   public String url() {
      return url;
   }

   public long timestamp() {
      return timestamp;
   }

   public String requestId() {
      return requestId;
   }

   public Object payload() {
      return payload;
   }

   /**
    * @return the payload when it is a JSON object, {@code null} otherwise.
    */
   public JsonObject payloadObject() {
      return payload instanceof JsonObject ? (JsonObject) payload : null;
   }

   public JsonObject toJson() {
      JsonObject json = new JsonObject().put("type", type.wireName());
      if (tabId != null) {
         json.put("tabId", tabId);
      }
      json.put("url", url == null ? "" : url);
      json.put("timestamp", timestamp);
      if (requestId != null) {
         json.put("requestId", requestId);
      }
      json.put("payload", payload);
      return json;
   }

   public String encode() {
      return toJson().encode();
   }

   @Override
   public String toString() {
      return type.wireName() + "(tab=" + tabId + ", url=" + url + (requestId == null ? "" : ", requestId=" + requestId) + ")";
   }
}
