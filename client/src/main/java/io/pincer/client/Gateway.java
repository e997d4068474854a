package io.pincer.client;

import io.pincer.api.config.ExtensionConfig;
import io.pincer.api.connection.ConnectionState;
import io.pincer.api.protocol.EventEnvelope;

/**
 * Tab-side end of the bridge socket.
 */
public interface Gateway {
   void connect();

   void disconnect();

   /**
    * @return {@code false} if the message could not be handed to an open socket.
    */
   boolean send(EventEnvelope message);

   ConnectionState state();

   void updateConfig(ExtensionConfig config);

   @FunctionalInterface
   interface Factory {
      Gateway create(ExtensionConfig config, ConnectionListener listener);
   }
}
