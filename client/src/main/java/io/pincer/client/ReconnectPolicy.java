package io.pincer.client;

import io.pincer.api.config.ExtensionConfig;

/**
 * Exponential backoff: the n-th reconnect (counting from 0) waits {@code baseDelay * 2^n} ms, and
 * nothing is scheduled once {@code maxAttempts} reconnects have been tried.
 */
public final class ReconnectPolicy {
   private static final int MAX_SHIFT = 30;

   private final int maxAttempts;
   private final long baseDelay;

   public ReconnectPolicy(int maxAttempts, long baseDelay) {
      if (maxAttempts < 0 || baseDelay <= 0) {
         throw new IllegalArgumentException("Invalid reconnect policy: " + maxAttempts + " attempts, " + baseDelay + " ms");
      }
      this.maxAttempts = maxAttempts;
      this.baseDelay = baseDelay;
   }

   public static ReconnectPolicy of(ExtensionConfig config) {
      return new ReconnectPolicy(config.reconnectMaxAttempts(), config.reconnectBaseDelay());
   }

   public boolean isExhausted(int attempts) {
      return attempts >= maxAttempts;
   }

   public long delay(int attempts) {
      return baseDelay << Math.min(attempts, MAX_SHIFT);
   }

   public int maxAttempts() {
      return maxAttempts;
   }

   public long baseDelay() {
      return baseDelay;
   }
}
