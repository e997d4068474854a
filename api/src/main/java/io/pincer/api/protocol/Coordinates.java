package io.pincer.api.protocol;

import java.util.Objects;

import io.vertx.core.json.JsonObject;

public final class Coordinates {
   private final double x;
   private final double y;

   public Coordinates(double x, double y) {
      this.x = x;
      this.y = y;
   }

   public double x() {
      return x;
   }

   public double y() {
      return y;
   }

   JsonObject toJson() {
      return new JsonObject().put("x", x).put("y", y);
   }

   static Coordinates fromJson(JsonObject json) {
      Number x = JsonFields.number(json, "x");
      Number y = JsonFields.number(json, "y");
      if (x == null || y == null) {
         throw new MalformedMessageException("Coordinates require both x and y: " + json.encode());
      }
      return new Coordinates(x.doubleValue(), y.doubleValue());
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (!(o instanceof Coordinates)) {
         return false;
      }
      Coordinates that = (Coordinates) o;
      return Double.compare(that.x, x) == 0 && Double.compare(that.y, y) == 0;
   }

   @Override
   public int hashCode() {
      return Objects.hash(x, y);
   }

   @Override
   public String toString() {
      return "(" + x + ", " + y + ")";
   }
}
