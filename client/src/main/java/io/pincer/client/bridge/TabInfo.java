package io.pincer.client.bridge;

import java.util.Objects;

import io.vertx.core.json.JsonObject;

public final class TabInfo {
   private final int tabId;
   private final String url;
   private final String title;

   public TabInfo(int tabId, String url, String title) {
      this.tabId = tabId;
      this.url = Objects.requireNonNull(url);
      this.title = title == null ? "" : title;
   }

   public int tabId() {
      return tabId;
   }

   public String url() {
      return url;
   }

   public String title() {
      return title;
   }

   public JsonObject toJson() {
      return new JsonObject().put("tabId", tabId).put("url", url).put("title", title);
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      } else if (!(o instanceof TabInfo)) {
         return false;
      }
      TabInfo other = (TabInfo) o;
      return tabId == other.tabId && url.equals(other.url) && title.equals(other.title);
   }

   @Override
   public int hashCode() {
      return Objects.hash(tabId, url, title);
   }

   @Override
   public String toString() {
      return "Tab " + tabId + " (" + url + ")";
   }
}
