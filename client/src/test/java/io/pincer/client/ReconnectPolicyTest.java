package io.pincer.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.pincer.api.config.ExtensionConfig;

public class ReconnectPolicyTest {
   @Test
   public void testDefaultSchedule() {
      ReconnectPolicy policy = ReconnectPolicy.of(ExtensionConfig.DEFAULT);
      List<Long> delays = new ArrayList<>();
      for (int attempts = 0; !policy.isExhausted(attempts); ++attempts) {
         delays.add(policy.delay(attempts));
      }
      assertThat(delays).containsExactly(1000L, 2000L, 4000L, 8000L, 16000L);
   }

   @Test
   public void testNoReconnects() {
      assertThat(new ReconnectPolicy(0, 1000).isExhausted(0)).isTrue();
   }

   @Test
   public void testShiftCapped() {
      ReconnectPolicy policy = new ReconnectPolicy(100, 1);
      assertThat(policy.delay(64)).isEqualTo(policy.delay(30)).isPositive();
   }

   @Test
   public void testInvalid() {
      assertThatThrownBy(() -> new ReconnectPolicy(-1, 1000)).isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> new ReconnectPolicy(5, 0)).isInstanceOf(IllegalArgumentException.class);
   }
}
