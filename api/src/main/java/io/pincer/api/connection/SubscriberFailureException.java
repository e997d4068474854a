package io.pincer.api.connection;

import io.pincer.api.PincerException;

/**
 * Wraps a failure thrown by a context listener. It is only ever logged; delivery to the other
 * listeners continues.
 */
public class SubscriberFailureException extends PincerException {
   public SubscriberFailureException(String connectionId, Throwable cause) {
      super("Context listener failed for " + connectionId, cause);
   }
}
