package io.pincer.host.registry;

import java.util.Objects;

import io.pincer.api.context.PageContext;
import io.vertx.core.json.JsonObject;

/**
 * Immutable view of one connected tab. The registry replaces its entry on every change, so an
 * instance obtained from {@link ConnectionRegistry#list()} or a lookup never changes afterwards.
 */
public final class TabConnection {
   private final String id;
   private final Integer tabId;
   private final String url;
   private final String title;
   private final TabSocket socket;
   private final long connectedAt;
   private final long lastActivity;
   private final PageContext context;

   public TabConnection(String id, Integer tabId, String url, String title, TabSocket socket, long connectedAt) {
      this(id, tabId, url, title, socket, connectedAt, connectedAt, null);
   }

   private TabConnection(String id, Integer tabId, String url, String title, TabSocket socket, long connectedAt,
                         long lastActivity, PageContext context) {
      this.id = Objects.requireNonNull(id);
      this.tabId = tabId;
      this.url = url == null ? "" : url;
      this.title = title == null ? "" : title;
      this.socket = Objects.requireNonNull(socket);
      this.connectedAt = connectedAt;
      this.lastActivity = lastActivity;
      this.context = context;
   }

   TabConnection withActivity(long timestamp) {
      if (timestamp <= lastActivity) {
         return this;
      }
      return new TabConnection(id, tabId, url, title, socket, connectedAt, timestamp, context);
   }

   TabConnection withTab(int tabId, String url) {
      String newUrl = url == null || url.isEmpty() ? this.url : url;
      return new TabConnection(id, tabId, newUrl, title, socket, connectedAt, lastActivity, context);
   }

   TabConnection withContext(PageContext context, long timestamp) {
      return new TabConnection(id, tabId, context.url(), context.title(), socket, connectedAt,
            Math.max(lastActivity, timestamp), context);
   }

   public String id() {
      return id;
   }

   public Integer tabId() {
      return tabId;
   }

   public String url() {
      return url;
   }

   public String title() {
      return title;
   }

   public TabSocket socket() {
      return socket;
   }

   public long connectedAt() {
      return connectedAt;
   }

   public long lastActivity() {
      return lastActivity;
   }

   public PageContext context() {
      return context;
   }

   public JsonObject toJson() {
      return new JsonObject()
            .put("id", id)
            .put("tabId", tabId)
            .put("url", url)
            .put("title", title)
            .put("connectedAt", connectedAt)
            .put("lastActivity", lastActivity)
            .put("hasContext", context != null);
   }

   @Override
   public String toString() {
      return id + (tabId == null ? "" : " (tab " + tabId + ")") + " " + url;
   }
}
