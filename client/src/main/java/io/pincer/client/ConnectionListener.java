package io.pincer.client;

import io.pincer.api.connection.ConnectionState;
import io.pincer.api.protocol.CommandEnvelope;

/**
 * Callbacks of {@link GatewayConnection}. State changes are delivered in the order they happen and
 * must not block.
 */
public interface ConnectionListener {
   default void onStatusChange(ConnectionState state) {
   }

   default void onCommand(CommandEnvelope command) {
   }

   default void onError(Throwable error) {
   }
}
