package io.pincer.api.protocol;

import java.util.HashMap;
import java.util.Map;

/**
 * Upstream messages, sent from a tab to the host.
 */
public enum EventType {
   CONNECT("connect"),
   DISCONNECT("disconnect"),
   PAGE_CONTEXT("page_context"),
   SELECTION("selection"),
   SCREENSHOT("screenshot"),
   DOM_SNAPSHOT("dom_snapshot"),
   CLICK_EVENT("click_event"),
   SCROLL_EVENT("scroll_event"),
   /**
    * The only upstream type whose {@code requestId} is meaningful: it must match a command sent
    * earlier on the same connection.
    */
   COMMAND_RESULT("command_result");

   private static final Map<String, EventType> BY_WIRE_NAME = new HashMap<>();

   static {
      for (EventType type : values()) {
         BY_WIRE_NAME.put(type.wireName, type);
      }
   }

   private final String wireName;

   EventType(String wireName) {
      this.wireName = wireName;
   }

   public String wireName() {
      return wireName;
   }

   public static EventType fromWireName(String name) {
      EventType type = BY_WIRE_NAME.get(name);
      if (type == null) {
         throw new UnknownMessageTypeException(name);
      }
      return type;
   }
}
