package io.pincer.api.connection;

import io.pincer.api.PincerException;

public class ConnectionNotOpenException extends PincerException {
   private final String connectionId;

   public ConnectionNotOpenException(String connectionId) {
      super("Connection not open: " + connectionId);
      this.connectionId = connectionId;
   }

   public ConnectionNotOpenException(String connectionId, Throwable cause) {
      super("Connection not open: " + connectionId, cause);
      this.connectionId = connectionId;
   }

   public String connectionId() {
      return connectionId;
   }
}
