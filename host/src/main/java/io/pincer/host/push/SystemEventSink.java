package io.pincer.host.push;

/**
 * Receives short, human readable notes about what the user is looking at, e.g. the assistant's
 * session. Implementations must not block.
 */
@FunctionalInterface
public interface SystemEventSink {
   void publish(String connectionId, String text);
}
