package io.pincer.api.connection;

import io.pincer.api.PincerException;

public class ConnectionNotFoundException extends PincerException {
   private final String connectionId;

   public ConnectionNotFoundException(String connectionId) {
      super("Connection not found: " + connectionId);
      this.connectionId = connectionId;
   }

   public String connectionId() {
      return connectionId;
   }
}
