package io.pincer.host.registry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.LongSupplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.pincer.api.connection.ConnectionNotFoundException;
import io.pincer.api.connection.ConnectionNotOpenException;
import io.pincer.api.connection.DuplicateRequestException;
import io.pincer.api.connection.SubscriberFailureException;
import io.pincer.api.context.PageContext;
import io.pincer.api.protocol.CommandEnvelope;
import io.vertx.core.Future;
import io.vertx.core.Vertx;

public class DefaultConnectionRegistry implements ConnectionRegistry {
   private static final Logger log = LogManager.getLogger(DefaultConnectionRegistry.class);

   private final Map<String, TabConnection> connections = new LinkedHashMap<>();
   private final List<ContextListener> listeners = new CopyOnWriteArrayList<>();
   private final Object contextUpdateLock = new Object();
   private final RequestCorrelator correlator;
   private final LongSupplier clock;

   public DefaultConnectionRegistry(Vertx vertx, long requestTimeout) {
      this(vertx, requestTimeout, System::currentTimeMillis);
   }

   public DefaultConnectionRegistry(Vertx vertx, long requestTimeout, LongSupplier clock) {
      this(new RequestCorrelator(vertx, requestTimeout), clock);
   }

   DefaultConnectionRegistry(RequestCorrelator correlator, LongSupplier clock) {
      this.correlator = correlator;
      this.clock = clock;
   }

   @Override
   public void add(TabConnection connection) {
      synchronized (this) {
         TabConnection previous = connections.put(connection.id(), connection);
         if (previous != null) {
            log.warn("Connection id {} was reused, replacing {}", connection.id(), previous);
         }
      }
      log.debug("Added connection {}", connection);
   }

   @Override
   public void remove(String id) {
      List<PendingRequest> detached;
      synchronized (this) {
         TabConnection removed = connections.remove(id);
         if (removed == null) {
            return;
         }
         detached = correlator.detach(id);
      }
      log.info("Removed connection {}, cancelling {} pending request(s)", id, detached.size());
      correlator.cancel(detached);
   }

   @Override
   public synchronized TabConnection get(String id) {
      return connections.get(id);
   }

   @Override
   public synchronized TabConnection getByTabId(int tabId) {
      for (TabConnection connection : connections.values()) {
         if (connection.tabId() != null && connection.tabId() == tabId) {
            return connection;
         }
      }
      return null;
   }

   @Override
   public synchronized List<TabConnection> list() {
      return List.copyOf(connections.values());
   }

   @Override
   public synchronized TabConnection getActive() {
      TabConnection active = null;
      for (TabConnection connection : connections.values()) {
         if (active == null || connection.lastActivity() > active.lastActivity()) {
            active = connection;
         }
      }
      return active;
   }

   @Override
   public void updateContext(String id, PageContext context) {
      // listeners run outside the registry monitor but must see updates in the order they were stored
      synchronized (contextUpdateLock) {
         TabConnection updated;
         synchronized (this) {
            TabConnection connection = connections.get(id);
            if (connection == null) {
               log.debug("Ignoring context for unknown connection {}", id);
               return;
            }
            updated = connection.withContext(context, clock.getAsLong());
            connections.put(id, updated);
         }
         for (ContextListener listener : listeners) {
            try {
               listener.onContextUpdate(updated, context);
            } catch (Throwable t) {
               log.error("Context handler error", new SubscriberFailureException(id, t));
            }
         }
      }
   }

   @Override
   public synchronized boolean bindTab(String id, int tabId, String url) {
      TabConnection connection = connections.get(id);
      if (connection == null) {
         return false;
      }
      if (connection.tabId() != null) {
         if (connection.tabId() != tabId) {
            log.debug("Connection {} is bound to tab {}, ignoring tab {}", id, connection.tabId(), tabId);
            return false;
         }
         return true;
      }
      connections.put(id, connection.withTab(tabId, url));
      log.info("Tab {} connected: {}", tabId, url);
      return true;
   }

   @Override
   public synchronized void touch(String id) {
      TabConnection connection = connections.get(id);
      if (connection != null) {
         connections.put(id, connection.withActivity(clock.getAsLong()));
      }
   }

   @Override
   public Future<Object> sendCommand(String id, CommandEnvelope command) {
      TabSocket socket;
      PendingRequest request;
      synchronized (this) {
         TabConnection connection = connections.get(id);
         if (connection == null) {
            return Future.failedFuture(new ConnectionNotFoundException(id));
         }
         socket = connection.socket();
         if (!socket.isOpen()) {
            return Future.failedFuture(new ConnectionNotOpenException(id));
         }
         try {
            request = correlator.register(new RequestKey(id, command.requestId()));
         } catch (DuplicateRequestException e) {
            return Future.failedFuture(e);
         }
      }
      log.debug("Sending {} to {}", command, id);
      request.markSent();
      socket.writeText(command.encode()).onFailure(cause -> {
         if (correlator.fail(request, new ConnectionNotOpenException(id, cause))) {
            log.error("Failed to send " + command + " to " + id, cause);
         }
      });
      return request.future();
   }

   @Override
   public boolean resolveCommand(String id, String requestId, Object result) {
      return correlator.resolve(new RequestKey(id, requestId), result);
   }

   @Override
   public Subscription onContextUpdate(ContextListener listener) {
      listeners.add(listener);
      return () -> listeners.remove(listener);
   }

   @Override
   public synchronized int size() {
      return connections.size();
   }

   @Override
   public int pendingCount() {
      return correlator.size();
   }

   @Override
   public void close() {
      List<String> ids;
      synchronized (this) {
         ids = new ArrayList<>(connections.keySet());
      }
      ids.forEach(this::remove);
   }
}
