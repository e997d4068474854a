package io.pincer.api.connection;

import io.pincer.api.PincerException;

public class DuplicateRequestException extends PincerException {
   public DuplicateRequestException(String connectionId, String requestId) {
      super("Request " + requestId + " is already pending on " + connectionId);
   }
}
