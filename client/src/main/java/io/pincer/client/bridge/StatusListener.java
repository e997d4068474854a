package io.pincer.client.bridge;

import io.pincer.api.connection.ConnectionState;

@FunctionalInterface
public interface StatusListener {
   void onStatus(ConnectionState state, int tabCount);
}
