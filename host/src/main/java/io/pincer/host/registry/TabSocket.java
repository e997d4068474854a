package io.pincer.host.registry;

import io.vertx.core.Future;

/**
 * Socket handle borrowed by the registry. The registry only checks whether it is writable and
 * writes frames to it; opening and closing belong to the transport.
 */
public interface TabSocket {
   boolean isOpen();

   Future<Void> writeText(String frame);

   String remoteAddress();
}
