package io.pincer.client;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.pincer.api.config.ExtensionConfig;
import io.pincer.api.connection.ConnectionState;
import io.pincer.api.protocol.CommandEnvelope;
import io.pincer.api.protocol.EventEnvelope;
import io.pincer.api.protocol.MalformedMessageException;
import io.pincer.api.protocol.UnknownMessageTypeException;
import io.vertx.core.AsyncResult;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.http.WebSocket;
import io.vertx.core.http.WebSocketClient;
import io.vertx.core.http.WebSocketConnectOptions;

/**
 * Reconnecting socket from a tab to the host.
 * <p>
 * Each attempt walks {@code DISCONNECTED -> CONNECTING -> CONNECTED -> DISCONNECTED} or
 * {@code DISCONNECTED -> CONNECTING -> ERROR -> DISCONNECTED}. Only the transition to
 * {@code DISCONNECTED} arms a reconnect, and at most one reconnect timer exists at a time. Socket
 * errors move to {@code ERROR} and close the socket; the close that follows does the rest.
 * <p>
 * Callbacks of a socket that has been superseded (by {@link #disconnect()} or a newer attempt)
 * are ignored.
 */
public class GatewayConnection implements Gateway {
   private static final Logger log = LogManager.getLogger(GatewayConnection.class);

   private final Vertx vertx;
   private final WebSocketClient client;
   private final ConnectionListener listener;
   private ExtensionConfig config;
   private ReconnectPolicy policy;

   private ConnectionState state = ConnectionState.DISCONNECTED;
   private WebSocket webSocket;
   private int reconnectAttempts;
   private long reconnectTimerId = -1;
   private long generation;
   private boolean closeRequested;

   public GatewayConnection(Vertx vertx, ExtensionConfig config, ConnectionListener listener) {
      this.vertx = vertx;
      this.client = vertx.createWebSocketClient();
      this.listener = listener;
      this.config = config;
      this.policy = ReconnectPolicy.of(config);
   }

   /**
    * Connects unless already connected or connecting. An explicit call cancels a pending reconnect
    * and restarts the backoff schedule.
    */
   @Override
   public void connect() {
      synchronized (this) {
         if (state == ConnectionState.CONNECTED || state == ConnectionState.CONNECTING) {
            log.debug("Already {}, not connecting again", state.label());
            return;
         }
         cancelReconnect();
         reconnectAttempts = 0;
      }
      open();
   }

   private void open() {
      WebSocketConnectOptions options;
      long attempt;
      synchronized (this) {
         if (state == ConnectionState.CONNECTED || state == ConnectionState.CONNECTING) {
            return;
         }
         closeRequested = false;
         attempt = ++generation;
         transition(ConnectionState.CONNECTING);
         try {
            options = connectOptions(config);
         } catch (IllegalArgumentException e) {
            // a bad URL does not get better by retrying
            transition(ConnectionState.ERROR);
            listener.onError(e);
            transition(ConnectionState.DISCONNECTED);
            return;
         }
      }
      log.debug("Connecting to {}:{}", options.getHost(), options.getPort());
      client.connect(options).onComplete(result -> onOpen(attempt, result));
   }

   static WebSocketConnectOptions connectOptions(ExtensionConfig config) {
      URI uri;
      try {
         uri = URI.create(config.gatewayUrl());
      } catch (IllegalArgumentException e) {
         throw new IllegalArgumentException("Invalid gateway URL: " + config.gatewayUrl(), e);
      }
      String scheme = uri.getScheme();
      boolean ssl;
      if ("wss".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme)) {
         ssl = true;
      } else if ("ws".equalsIgnoreCase(scheme) || "http".equalsIgnoreCase(scheme)) {
         ssl = false;
      } else {
         throw new IllegalArgumentException("Unsupported gateway URL scheme: " + config.gatewayUrl());
      }
      if (uri.getHost() == null) {
         throw new IllegalArgumentException("Gateway URL has no host: " + config.gatewayUrl());
      }
      int port = uri.getPort() >= 0 ? uri.getPort() : (ssl ? 443 : 80);
      StringBuilder requestUri = new StringBuilder(uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath());
      String query = uri.getRawQuery();
      if (query != null && !query.isEmpty()) {
         requestUri.append('?').append(query);
      }
      if (config.token() != null) {
         requestUri.append(query == null || query.isEmpty() ? '?' : '&')
               .append("token=").append(URLEncoder.encode(config.token(), StandardCharsets.UTF_8));
      }
      return new WebSocketConnectOptions().setHost(uri.getHost()).setPort(port).setSsl(ssl).setURI(requestUri.toString());
   }

   private void onOpen(long attempt, AsyncResult<WebSocket> result) {
      synchronized (this) {
         if (attempt != generation) {
            if (result.succeeded()) {
               result.result().close();
            }
            return;
         }
         if (result.failed()) {
            log.info("Failed to connect to {}: {}", config.gatewayUrl(), result.cause().getMessage());
            transition(ConnectionState.ERROR);
            listener.onError(result.cause());
            // no socket means no close event; this is the close
            transition(ConnectionState.DISCONNECTED);
            scheduleReconnect();
            return;
         }
         WebSocket ws = result.result();
         webSocket = ws;
         reconnectAttempts = 0;
         ws.textMessageHandler(frame -> onFrame(attempt, frame));
         ws.closeHandler(nil -> onClose(attempt));
         ws.exceptionHandler(t -> onSocketError(attempt, ws, t));
         transition(ConnectionState.CONNECTED);
      }
      log.info("Connected to {}", config.gatewayUrl());
   }

   private void onFrame(long attempt, String frame) {
      synchronized (this) {
         if (attempt != generation) {
            return;
         }
      }
      CommandEnvelope command;
      try {
         command = CommandEnvelope.decode(frame);
      } catch (UnknownMessageTypeException e) {
         log.debug("Dropping command of unknown type {}", e.type());
         return;
      } catch (MalformedMessageException e) {
         log.error("Failed to parse command: {}", e.getMessage());
         return;
      }
      try {
         listener.onCommand(command);
      } catch (Throwable t) {
         log.error("Command handler failed for " + command, t);
      }
   }

   private synchronized void onClose(long attempt) {
      if (attempt != generation) {
         return;
      }
      webSocket = null;
      transition(ConnectionState.DISCONNECTED);
      if (!closeRequested) {
         scheduleReconnect();
      }
   }

   private void onSocketError(long attempt, WebSocket ws, Throwable error) {
      synchronized (this) {
         if (attempt != generation) {
            return;
         }
         log.error("WebSocket error", error);
         if (state == ConnectionState.CONNECTED) {
            transition(ConnectionState.ERROR);
            listener.onError(error);
         }
      }
      // reconnect is driven by the close handler
      ws.close();
   }

   @Override
   public void disconnect() {
      WebSocket ws;
      synchronized (this) {
         cancelReconnect();
         reconnectAttempts = policy.maxAttempts();
         closeRequested = true;
         ++generation;
         ws = webSocket;
         webSocket = null;
         transition(ConnectionState.DISCONNECTED);
      }
      if (ws != null) {
         ws.close();
      }
   }

   /**
    * Closes the socket and releases the underlying client.
    */
   public void close() {
      disconnect();
      client.close();
   }

   @Override
   public boolean send(EventEnvelope message) {
      WebSocket ws;
      synchronized (this) {
         ws = state == ConnectionState.CONNECTED ? webSocket : null;
      }
      if (ws == null) {
         log.warn("Cannot send {} - not connected", message);
         return false;
      }
      try {
         ws.writeTextMessage(message.encode()).onFailure(t -> log.error("Send failed: " + message, t));
         return true;
      } catch (IllegalStateException e) {
         log.error("Send failed: " + message, e);
         return false;
      }
   }

   @Override
   public synchronized ConnectionState state() {
      return state;
   }

   @Override
   public synchronized void updateConfig(ExtensionConfig config) {
      this.config = config;
      this.policy = ReconnectPolicy.of(config);
   }

   public synchronized int reconnectAttempts() {
      return reconnectAttempts;
   }

   public synchronized boolean isReconnectScheduled() {
      return reconnectTimerId >= 0;
   }

   private void scheduleReconnect() {
      assert Thread.holdsLock(this);
      if (reconnectTimerId >= 0 || !state.canArmReconnect()) {
         return;
      }
      if (policy.isExhausted(reconnectAttempts)) {
         log.info("Max reconnect attempts reached");
         return;
      }
      long delay = policy.delay(reconnectAttempts);
      ++reconnectAttempts;
      log.info("Reconnecting in {}ms (attempt {})", delay, reconnectAttempts);
      reconnectTimerId = setTimer(delay, this::onReconnectTimer);
   }

   private void onReconnectTimer(long timerId) {
      synchronized (this) {
         if (timerId != reconnectTimerId) {
            return;
         }
         reconnectTimerId = -1;
      }
      open();
   }

   private void cancelReconnect() {
      if (reconnectTimerId >= 0) {
         cancelTimer(reconnectTimerId);
         reconnectTimerId = -1;
      }
   }

   private void transition(ConnectionState newState) {
      if (state == newState) {
         return;
      }
      log.trace("{} -> {}", state, newState);
      state = newState;
      try {
         listener.onStatusChange(newState);
      } catch (Throwable t) {
         log.error("Status listener failed", t);
      }
   }

   protected long setTimer(long delay, Handler<Long> handler) {
      return vertx.setTimer(delay, handler);
   }

   protected boolean cancelTimer(long timerId) {
      return vertx.cancelTimer(timerId);
   }
}
