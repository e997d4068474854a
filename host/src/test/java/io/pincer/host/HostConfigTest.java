package io.pincer.host;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import io.pincer.internal.Properties;
import io.vertx.core.json.JsonObject;

public class HostConfigTest {
   @Test
   public void testDefaults() {
      HostConfig config = HostConfig.defaults();
      assertThat(config.enabled()).isTrue();
      assertThat(config.port()).isEqualTo(18789);
      assertThat(config.wsPath()).isEqualTo("/pincer");
      assertThat(config.requestTimeout()).isEqualTo(30000);
      assertThat(config.pushContextOnSwitch()).isTrue();
   }

   @Test
   public void testVerticleConfig() {
      HostConfig config = HostConfig.from(new JsonObject()
            .put(Properties.PORT, 9999)
            .put(Properties.WS_PATH, "/bridge/")
            .put(Properties.REQUEST_TIMEOUT, "500")
            .put(Properties.PUSH_CONTEXT_ON_SWITCH, false));
      assertThat(config.port()).isEqualTo(9999);
      assertThat(config.wsPath()).isEqualTo("/bridge");
      assertThat(config.requestTimeout()).isEqualTo(500);
      assertThat(config.pushContextOnSwitch()).isFalse();
   }

   @Test
   public void testSystemPropertyWins() {
      System.setProperty(Properties.REQUEST_TIMEOUT, "1234");
      try {
         HostConfig config = HostConfig.from(new JsonObject().put(Properties.REQUEST_TIMEOUT, 500));
         assertThat(config.requestTimeout()).isEqualTo(1234);
      } finally {
         System.clearProperty(Properties.REQUEST_TIMEOUT);
      }
   }

   @Test
   public void testInvalid() {
      assertThatThrownBy(() -> new HostConfig(true, "localhost", 0, "pincer", 1000, true))
            .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> new HostConfig(true, "localhost", 0, "/pincer", 0, true))
            .isInstanceOf(IllegalArgumentException.class);
   }
}
