package io.pincer.api.protocol;

import java.util.HashMap;
import java.util.Map;

/**
 * Downstream messages, sent from the host to a tab.
 */
public enum CommandType {
   GET_CONTEXT("get_context"),
   GET_SNAPSHOT("get_snapshot"),
   SCREENSHOT("screenshot"),
   HIGHLIGHT("highlight"),
   CLICK("click"),
   TYPE("type"),
   SCROLL("scroll"),
   NAVIGATE("navigate"),
   /**
    * Reserved. Arbitrary script execution is disabled by policy and always rejected by the tab side.
    */
   EXECUTE("execute");

   private static final Map<String, CommandType> BY_WIRE_NAME = new HashMap<>();

   static {
      for (CommandType type : values()) {
         BY_WIRE_NAME.put(type.wireName, type);
      }
   }

   private final String wireName;

   CommandType(String wireName) {
      this.wireName = wireName;
   }

   public String wireName() {
      return wireName;
   }

   public boolean isRejectedByPolicy() {
      return this == EXECUTE;
   }

   public static CommandType fromWireName(String name) {
      CommandType type = BY_WIRE_NAME.get(name);
      if (type == null) {
         throw new UnknownMessageTypeException(name);
      }
      return type;
   }
}
