package io.pincer.host.registry;

import java.util.Objects;

public final class RequestKey {
   private final String connectionId;
   private final String requestId;

   public RequestKey(String connectionId, String requestId) {
      this.connectionId = Objects.requireNonNull(connectionId);
      this.requestId = Objects.requireNonNull(requestId);
   }

   public String connectionId() {
      return connectionId;
   }

   public String requestId() {
      return requestId;
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (!(o instanceof RequestKey)) {
         return false;
      }
      RequestKey that = (RequestKey) o;
      return connectionId.equals(that.connectionId) && requestId.equals(that.requestId);
   }

   @Override
   public int hashCode() {
      return 31 * connectionId.hashCode() + requestId.hashCode();
   }

   @Override
   public String toString() {
      return connectionId + ":" + requestId;
   }
}
