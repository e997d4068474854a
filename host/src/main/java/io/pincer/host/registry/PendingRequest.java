package io.pincer.host.registry;

import io.vertx.core.Future;
import io.vertx.core.Promise;

/**
 * A command waiting for its {@code command_result}. Exactly one of the terminal statuses is ever
 * reached; the first terminal transition completes the future and later ones are ignored.
 */
public final class PendingRequest {
   private final RequestKey key;
   private final Promise<Object> promise = Promise.promise();
   private final long deadline;
   private long timerId = -1;
   private Status status = Status.CREATED;

   PendingRequest(RequestKey key, long deadline) {
      this.key = key;
      this.deadline = deadline;
   }

   public RequestKey key() {
      return key;
   }

   public long deadline() {
      return deadline;
   }

   public Future<Object> future() {
      return promise.future();
   }

   public synchronized Status status() {
      return status;
   }

   synchronized long timerId() {
      return timerId;
   }

   synchronized void timerId(long timerId) {
      this.timerId = timerId;
   }

   synchronized void markSent() {
      if (status == Status.CREATED) {
         status = Status.SENT;
      }
   }

   boolean resolve(Object result) {
      if (!transition(Status.RESOLVED)) {
         return false;
      }
      promise.complete(result);
      return true;
   }

   boolean fail(Status terminal, Throwable cause) {
      if (!transition(terminal)) {
         return false;
      }
      promise.fail(cause);
      return true;
   }

   private synchronized boolean transition(Status terminal) {
      if (status.isTerminal()) {
         return false;
      }
      status = terminal;
      return true;
   }

   @Override
   public String toString() {
      return key + " [" + status() + "]";
   }

   public enum Status {
      CREATED,
      SENT,
      RESOLVED,
      TIMED_OUT,
      CANCELLED,
      FAILED;

      public boolean isTerminal() {
         return this != CREATED && this != SENT;
      }
   }
}
