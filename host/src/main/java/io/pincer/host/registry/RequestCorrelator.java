package io.pincer.host.registry;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.pincer.api.connection.CommandTimeoutException;
import io.pincer.api.connection.ConnectionClosedException;
import io.pincer.api.connection.DuplicateRequestException;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;

/**
 * Matches commands to their results. Every entry leaves the map exactly once: on the matching
 * result, on its timeout or when its connection goes away. The entry is removed and its timer
 * cancelled before the future is completed, and futures are never completed while holding the lock.
 */
public class RequestCorrelator {
   private static final Logger log = LogManager.getLogger(RequestCorrelator.class);

   private final Vertx vertx;
   private final long timeout;
   private final Map<RequestKey, PendingRequest> pending = new HashMap<>();

   public RequestCorrelator(Vertx vertx, long timeout) {
      if (timeout <= 0) {
         throw new IllegalArgumentException("Request timeout must be positive: " + timeout);
      }
      this.vertx = vertx;
      this.timeout = timeout;
   }

   public long timeout() {
      return timeout;
   }

   public synchronized PendingRequest register(RequestKey key) {
      if (pending.containsKey(key)) {
         throw new DuplicateRequestException(key.connectionId(), key.requestId());
      }
      PendingRequest request = new PendingRequest(key, System.currentTimeMillis() + timeout);
      pending.put(key, request);
      // the timer cannot run expire() before we release the monitor
      request.timerId(setTimer(timeout, timerId -> expire(request)));
      log.trace("Registered {}, {} pending", key, pending.size());
      return request;
   }

   /**
    * @return {@code true} if a pending request was completed with {@code result}.
    */
   public boolean resolve(RequestKey key, Object result) {
      PendingRequest request;
      synchronized (this) {
         request = pending.remove(key);
         if (request == null) {
            log.debug("Ignoring result for {}: no such pending request (late or duplicate)", key);
            return false;
         }
         cancelTimer(request.timerId());
      }
      return request.resolve(result);
   }

   /**
    * Fails a single request, e.g. when writing it to the socket did not succeed.
    */
   public boolean fail(PendingRequest request, Throwable cause) {
      synchronized (this) {
         if (!pending.remove(request.key(), request)) {
            return false;
         }
         cancelTimer(request.timerId());
      }
      return request.fail(PendingRequest.Status.FAILED, cause);
   }

   /**
    * Removes all requests of the connection and cancels their timers. The caller fails them through
    * {@link #cancel(List)} once it has released its own locks.
    */
   public synchronized List<PendingRequest> detach(String connectionId) {
      List<PendingRequest> detached = new ArrayList<>();
      for (Iterator<PendingRequest> it = pending.values().iterator(); it.hasNext(); ) {
         PendingRequest request = it.next();
         if (request.key().connectionId().equals(connectionId)) {
            it.remove();
            cancelTimer(request.timerId());
            detached.add(request);
         }
      }
      return detached;
   }

   public void cancel(List<PendingRequest> detached) {
      for (PendingRequest request : detached) {
         RequestKey key = request.key();
         if (request.fail(PendingRequest.Status.CANCELLED, new ConnectionClosedException(key.connectionId(), key.requestId()))) {
            log.debug("Cancelled {}: connection closed", key);
         }
      }
   }

   public synchronized int size() {
      return pending.size();
   }

   public synchronized boolean isPending(RequestKey key) {
      return pending.containsKey(key);
   }

   protected long setTimer(long delay, Handler<Long> handler) {
      return vertx.setTimer(delay, handler);
   }

   protected boolean cancelTimer(long timerId) {
      return vertx.cancelTimer(timerId);
   }

   private void expire(PendingRequest request) {
      synchronized (this) {
         // a newer request may have reused the key after this one completed
         if (!pending.remove(request.key(), request)) {
            return;
         }
      }
      RequestKey key = request.key();
      if (request.fail(PendingRequest.Status.TIMED_OUT, new CommandTimeoutException(key.connectionId(), key.requestId(), timeout))) {
         log.warn("Command {} timed out after {} ms", key, timeout);
      }
   }
}
