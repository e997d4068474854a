package io.pincer.host;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import io.pincer.internal.Properties;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;

@ExtendWith(VertxExtension.class)
public class HostVerticleTest {
   @Test
   public void testDeployAndUndeploy(Vertx vertx, VertxTestContext ctx) {
      List<String> published = new ArrayList<>();
      HostVerticle verticle = new HostVerticle((connectionId, text) -> published.add(text));
      JsonObject config = new JsonObject().put(Properties.HOST, "localhost").put(Properties.PORT, 0);
      vertx.deployVerticle(verticle, new DeploymentOptions().setConfig(config))
            .compose(deploymentId -> {
               ctx.verify(() -> {
                  assertThat(verticle.host().actualPort()).isPositive();
                  assertThat(verticle.host().config().wsPath()).isEqualTo("/pincer");
               });
               return vertx.undeploy(deploymentId);
            })
            .onComplete(ctx.succeeding(nil -> ctx.verify(() -> {
               assertThat(verticle.host().actualPort()).isEqualTo(-1);
               assertThat(published).isEmpty();
               ctx.completeNow();
            })));
   }

   @Test
   public void testDisabled(Vertx vertx, VertxTestContext ctx) {
      HostVerticle verticle = new HostVerticle();
      vertx.deployVerticle(verticle, new DeploymentOptions().setConfig(new JsonObject().put(Properties.ENABLED, false)))
            .onComplete(ctx.succeeding(id -> ctx.verify(() -> {
               assertThat(verticle.host().actualPort()).isEqualTo(-1);
               ctx.completeNow();
            })));
   }
}
