package io.pincer.host;

import java.util.concurrent.ThreadLocalRandom;

final class ConnectionIds {
   private static final long SUFFIX_RANGE = 36L * 36 * 36 * 36 * 36 * 36;

   private ConnectionIds() {
   }

   static String next() {
      String suffix = Long.toString(ThreadLocalRandom.current().nextLong(SUFFIX_RANGE), 36);
      StringBuilder sb = new StringBuilder("pincer-").append(System.currentTimeMillis()).append('-');
      for (int i = suffix.length(); i < 6; ++i) {
         sb.append('0');
      }
      return sb.append(suffix).toString();
   }
}
