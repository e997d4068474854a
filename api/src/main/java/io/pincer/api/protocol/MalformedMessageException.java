package io.pincer.api.protocol;

import io.pincer.api.PincerException;

public class MalformedMessageException extends PincerException {
   public MalformedMessageException(String message) {
      super(message);
   }

   public MalformedMessageException(String message, Throwable cause) {
      super(message, cause);
   }
}
