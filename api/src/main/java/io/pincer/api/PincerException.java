package io.pincer.api;

/**
 * Base of all failures reported by the bridge. None of them is fatal for the process; they are
 * delivered as failed futures or logged and dropped at the transport boundary.
 */
public class PincerException extends RuntimeException {
   public PincerException(String message) {
      super(message);
   }

   public PincerException(String message, Throwable cause) {
      super(message, cause);
   }
}
