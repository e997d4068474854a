package io.pincer.api.context;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import io.pincer.api.protocol.JsonFields;
import io.pincer.api.protocol.MalformedMessageException;
import io.vertx.core.json.JsonObject;

/**
 * Snapshot of a tab's page state. Instances are immutable: an update replaces the whole context.
 */
public final class PageContext {
   private final String url;
   private final String title;
   private final String favicon;
   private final String selectedText;
   private final String visibleText;
   private final Map<String, String> meta;
   private final long timestamp;

   public PageContext(String url, String title, String favicon, String selectedText, String visibleText,
                      Map<String, String> meta, long timestamp) {
      this.url = url == null ? "" : url;
      this.title = title == null ? "" : title;
      this.favicon = favicon;
      this.selectedText = selectedText;
      this.visibleText = visibleText;
      this.meta = meta == null || meta.isEmpty() ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(meta));
      this.timestamp = timestamp;
   }

   public static PageContext of(String url, String title) {
      return new PageContext(url, title, null, null, null, null, System.currentTimeMillis());
   }

   /**
    * Reads the fields the bridge understands from an opaque payload; anything else is ignored.
    */
   public static PageContext fromJson(JsonObject json) {
      if (json == null) {
         throw new MalformedMessageException("Page context payload is missing");
      }
      Map<String, String> meta = null;
      JsonObject metaJson = JsonFields.object(json, "meta");
      if (metaJson != null) {
         meta = new LinkedHashMap<>();
         for (Map.Entry<String, Object> entry : metaJson) {
            if (entry.getValue() != null) {
               meta.put(entry.getKey(), String.valueOf(entry.getValue()));
            }
         }
      }
      Number timestamp = JsonFields.number(json, "timestamp");
      return new PageContext(
            JsonFields.string(json, "url"),
            JsonFields.string(json, "title"),
            JsonFields.string(json, "favicon"),
            JsonFields.string(json, "selectedText"),
            JsonFields.string(json, "visibleText"),
            meta,
            timestamp == null ? 0 : timestamp.longValue());
   }

   public PageContext withTimestamp(long timestamp) {
      return new PageContext(url, title, favicon, selectedText, visibleText, meta, timestamp);
   }

   public String url() {
      return url;
   }

   public String title() {
      return title;
   }

   public String favicon() {
      return favicon;
   }

   public String selectedText() {
      return selectedText;
   }

   public String visibleText() {
      return visibleText;
   }

   public Map<String, String> meta() {
      return meta;
   }

   public long timestamp() {
      return timestamp;
   }

   public JsonObject toJson() {
      JsonObject json = new JsonObject().put("url", url).put("title", title);
      if (favicon != null) {
         json.put("favicon", favicon);
      }
      if (selectedText != null) {
         json.put("selectedText", selectedText);
      }
      if (visibleText != null) {
         json.put("visibleText", visibleText);
      }
      if (!meta.isEmpty()) {
         JsonObject metaJson = new JsonObject();
         meta.forEach(metaJson::put);
         json.put("meta", metaJson);
      }
      return json.put("timestamp", timestamp);
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (!(o instanceof PageContext)) {
         return false;
      }
      PageContext that = (PageContext) o;
      return timestamp == that.timestamp && url.equals(that.url) && title.equals(that.title)
            && Objects.equals(favicon, that.favicon) && Objects.equals(selectedText, that.selectedText)
            && Objects.equals(visibleText, that.visibleText) && meta.equals(that.meta);
   }

   @Override
   public int hashCode() {
      return Objects.hash(url, title, favicon, selectedText, visibleText, meta, timestamp);
   }

   @Override
   public String toString() {
      return "PageContext{url=" + url + ", title=" + title + ", timestamp=" + timestamp + "}";
   }
}
