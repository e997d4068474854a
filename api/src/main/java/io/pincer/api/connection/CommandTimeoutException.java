package io.pincer.api.connection;

import io.pincer.api.PincerException;

public class CommandTimeoutException extends PincerException {
   private final String connectionId;
   private final String requestId;
   private final long timeout;

   public CommandTimeoutException(String connectionId, String requestId, long timeout) {
      super("Command " + requestId + " on " + connectionId + " timed out after " + timeout + " ms");
      this.connectionId = connectionId;
      this.requestId = requestId;
      this.timeout = timeout;
   }

   public String connectionId() {
      return connectionId;
   }

   public String requestId() {
      return requestId;
   }

   public long timeout() {
      return timeout;
   }
}
