package io.pincer.host;

import io.pincer.host.registry.TabSocket;
import io.vertx.core.Future;
import io.vertx.core.http.ServerWebSocket;

class WebSocketTabSocket implements TabSocket {
   private final ServerWebSocket webSocket;

   WebSocketTabSocket(ServerWebSocket webSocket) {
      this.webSocket = webSocket;
   }

   @Override
   public boolean isOpen() {
      return !webSocket.isClosed();
   }

   @Override
   public Future<Void> writeText(String frame) {
      return webSocket.writeTextMessage(frame);
   }

   @Override
   public String remoteAddress() {
      return String.valueOf(webSocket.remoteAddress());
   }
}
