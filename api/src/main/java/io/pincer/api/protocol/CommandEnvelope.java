package io.pincer.api.protocol;

import java.util.Objects;

import io.vertx.core.json.JsonObject;

/**
 * Downstream message:
 * {@code {type, requestId, tabId?, selector?, ref?, coordinates?, text?, url?, options?}}.
 */
public final class CommandEnvelope {
   private final CommandType type;
   private final String requestId;
   private final Integer tabId;
   private final String selector;
   private final String ref;
   private final Coordinates coordinates;
   private final String text;
   private final String url;
   private final JsonObject options;

   private CommandEnvelope(Builder builder) {
      this.type = builder.type;
      this.requestId = builder.requestId;
      this.tabId = builder.tabId;
      this.selector = builder.selector;
      this.ref = builder.ref;
      this.coordinates = builder.coordinates;
      this.text = builder.text;
      this.url = builder.url;
      this.options = builder.options == null ? null : builder.options.copy();
   }

   public static Builder builder(CommandType type, String requestId) {
      return new Builder(type, requestId);
   }

   public static CommandEnvelope decode(String text) {
      return fromJson(JsonFields.parse(text));
   }

   public static CommandEnvelope fromJson(JsonObject json) {
      CommandType type = CommandType.fromWireName(JsonFields.requiredString(json, "type"));
      Builder builder = new Builder(type, JsonFields.requiredString(json, "requestId"))
            .tabId(JsonFields.integer(json, "tabId"))
            .selector(JsonFields.string(json, "selector"))
            .ref(JsonFields.string(json, "ref"))
            .text(JsonFields.string(json, "text"))
            .url(JsonFields.string(json, "url"))
            .options(JsonFields.object(json, "options"));
      JsonObject coordinates = JsonFields.object(json, "coordinates");
      if (coordinates != null) {
         builder.coordinates(Coordinates.fromJson(coordinates));
      }
      return builder.build();
   }

   public CommandType type() {
      return type;
   }

   public String requestId() {
      return requestId;
   }

   public Integer tabId() {
      return tabId;
   }

   public String selector() {
      return selector;
   }

   public String ref() {
      return ref;
   }

   public Coordinates coordinates() {
      return coordinates;
   }

   public String text() {
      return text;
   }

   public String url() {
      return url;
   }

   public JsonObject options() {
      return options == null ? null : options.copy();
   }

   public JsonObject toJson() {
      JsonObject json = new JsonObject().put("type", type.wireName()).put("requestId", requestId);
      if (tabId != null) {
         json.put("tabId", tabId);
      }
      if (selector != null) {
         json.put("selector", selector);
      }
      if (ref != null) {
         json.put("ref", ref);
      }
      if (coordinates != null) {
         json.put("coordinates", coordinates.toJson());
      }
      if (text != null) {
         json.put("text", text);
      }
      if (url != null) {
         json.put("url", url);
      }
      if (options != null) {
         json.put("options", options.copy());
      }
      return json;
   }

   public String encode() {
      return toJson().encode();
   }

   @Override
   public String toString() {
      return type.wireName() + "(" + requestId + ")";
   }

   public static class Builder {
      private final CommandType type;
      private final String requestId;
      private Integer tabId;
      private String selector;
      private String ref;
      private Coordinates coordinates;
      private String text;
      private String url;
      private JsonObject options;

      private Builder(CommandType type, String requestId) {
         this.type = Objects.requireNonNull(type, "type");
         this.requestId = Objects.requireNonNull(requestId, "requestId");
      }

      public Builder tabId(Integer tabId) {
         this.tabId = tabId;
         return this;
      }

      public Builder selector(String selector) {
         this.selector = selector;
         return this;
      }

      public Builder ref(String ref) {
         this.ref = ref;
         return this;
      }

      public Builder coordinates(Coordinates coordinates) {
         this.coordinates = coordinates;
         return this;
      }

      public Builder coordinates(double x, double y) {
         return coordinates(new Coordinates(x, y));
      }

      public Builder text(String text) {
         this.text = text;
         return this;
      }

      public Builder url(String url) {
         this.url = url;
         return this;
      }

      public Builder options(JsonObject options) {
         this.options = options;
         return this;
      }

      public CommandEnvelope build() {
         return new CommandEnvelope(this);
      }
   }
}
