package io.pincer.api.connection;

import io.pincer.api.PincerException;

/**
 * The connection was removed while a command sent through it was still waiting for its result.
 */
public class ConnectionClosedException extends PincerException {
   private final String connectionId;
   private final String requestId;

   public ConnectionClosedException(String connectionId, String requestId) {
      super("Connection " + connectionId + " closed before request " + requestId + " completed");
      this.connectionId = connectionId;
      this.requestId = requestId;
   }

   public String connectionId() {
      return connectionId;
   }

   public String requestId() {
      return requestId;
   }
}
