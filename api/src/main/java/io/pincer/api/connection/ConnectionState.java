package io.pincer.api.connection;

/**
 * State of the socket owned by the tab side. {@link #ERROR} is transient: it is always followed by
 * {@link #DISCONNECTED}.
 */
public enum ConnectionState {
   DISCONNECTED("disconnected"),
   CONNECTING("connecting"),
   CONNECTED("connected"),
   ERROR("error");

   private final String label;

   ConnectionState(String label) {
      this.label = label;
   }

   public String label() {
      return label;
   }

   public boolean canArmReconnect() {
      return this == DISCONNECTED || this == ERROR;
   }
}
