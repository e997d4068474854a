package io.pincer.api.protocol;

public class UnknownMessageTypeException extends MalformedMessageException {
   private final String type;

   public UnknownMessageTypeException(String type) {
      super("Unknown message type: " + type);
      this.type = type;
   }

   public String type() {
      return type;
   }
}
