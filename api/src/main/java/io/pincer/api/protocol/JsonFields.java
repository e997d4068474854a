package io.pincer.api.protocol;

import java.math.BigDecimal;

import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * Typed access to envelope fields. Wrong field types are reported as
 * {@link MalformedMessageException} rather than {@link ClassCastException}.
 */
public final class JsonFields {
   private JsonFields() {
   }

   public static JsonObject parse(String text) {
      if (text == null || text.isBlank()) {
         throw new MalformedMessageException("Empty frame");
      }
      try {
         return new JsonObject(text);
      } catch (DecodeException | ClassCastException e) {
         throw new MalformedMessageException("Frame is not a JSON object: " + abbreviate(text, 80), e);
      }
   }

   public static String string(JsonObject json, String field) {
      Object value = json.getValue(field);
      if (value == null || value instanceof String) {
         return (String) value;
      }
      throw new MalformedMessageException("Field '" + field + "' must be a string, got " + value);
   }

   public static String requiredString(JsonObject json, String field) {
      String value = string(json, field);
      if (value == null || value.isEmpty()) {
         throw new MalformedMessageException("Missing field '" + field + "'");
      }
      return value;
   }

   public static Number number(JsonObject json, String field) {
      Object value = json.getValue(field);
      if (value == null || value instanceof Number) {
         return (Number) value;
      }
      throw new MalformedMessageException("Field '" + field + "' must be a number, got " + value);
   }

   /**
    * Fractions and values outside the {@code int} range are malformed, never truncated.
    */
   public static Integer integer(JsonObject json, String field) {
      Number value = number(json, field);
      if (value == null) {
         return null;
      }
      try {
         return exact(value).intValueExact();
      } catch (ArithmeticException e) {
         throw new MalformedMessageException("Field '" + field + "' must be a 32-bit integer, got " + value, e);
      }
   }

   public static Long longInteger(JsonObject json, String field) {
      Number value = number(json, field);
      if (value == null) {
         return null;
      }
      try {
         return exact(value).longValueExact();
      } catch (ArithmeticException e) {
         throw new MalformedMessageException("Field '" + field + "' must be a 64-bit integer, got " + value, e);
      }
   }

   private static BigDecimal exact(Number value) {
      if (value instanceof BigDecimal) {
         return (BigDecimal) value;
      }
      try {
         return new BigDecimal(value.toString());
      } catch (NumberFormatException e) {
         // NaN and infinities
         throw new ArithmeticException(value + " is not finite");
      }
   }

   public static Boolean bool(JsonObject json, String field) {
      Object value = json.getValue(field);
      if (value == null || value instanceof Boolean) {
         return (Boolean) value;
      }
      throw new MalformedMessageException("Field '" + field + "' must be a boolean, got " + value);
   }

   public static JsonArray array(JsonObject json, String field) {
      Object value = json.getValue(field);
      if (value == null || value instanceof JsonArray) {
         return (JsonArray) value;
      }
      throw new MalformedMessageException("Field '" + field + "' must be an array, got " + value);
   }

   public static JsonObject object(JsonObject json, String field) {
      Object value = json.getValue(field);
      if (value == null || value instanceof JsonObject) {
         return (JsonObject) value;
      }
      throw new MalformedMessageException("Field '" + field + "' must be an object, got " + value);
   }

   public static String abbreviate(String text, int maxLength) {
      if (text == null || text.length() <= maxLength) {
         return text;
      }
      return text.substring(0, maxLength) + "...";
   }
}
