package io.pincer.host;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import io.pincer.api.connection.ConnectionNotFoundException;
import io.pincer.api.context.PageContext;
import io.pincer.api.protocol.CommandEnvelope;
import io.pincer.api.protocol.CommandType;
import io.pincer.host.registry.DefaultConnectionRegistry;
import io.pincer.host.registry.RecordingSocket;
import io.pincer.host.registry.TabConnection;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;

@ExtendWith(VertxExtension.class)
public class TabCommandServiceTest {
   private final AtomicLong clock = new AtomicLong(1000);
   private DefaultConnectionRegistry registry;
   private TabCommandService service;

   @BeforeEach
   public void before(Vertx vertx) {
      registry = new DefaultConnectionRegistry(vertx, 30000, clock::get);
      service = new TabCommandService(registry);
   }

   private RecordingSocket connect(String id, int tabId) {
      RecordingSocket socket = new RecordingSocket();
      registry.add(new TabConnection(id, tabId, "https://example.com/" + id, id, socket, clock.incrementAndGet()));
      return socket;
   }

   @Test
   public void testNoTabs(VertxTestContext ctx) {
      service.send(null, CommandType.SCREENSHOT).onComplete(ctx.failing(cause -> ctx.verify(() -> {
         assertThat(cause).isInstanceOf(ConnectionNotFoundException.class).hasMessageContaining(TabCommandService.ACTIVE);
         ctx.completeNow();
      })));
   }

   @Test
   public void testTargetsMostActiveTab() {
      RecordingSocket first = connect("c1", 1);
      RecordingSocket second = connect("c2", 2);
      service.send(null, CommandType.TYPE, builder -> builder.selector("#q").text("hello"));
      assertThat(first.frames()).isEmpty();
      assertThat(second.frames()).hasSize(1);

      CommandEnvelope sent = CommandEnvelope.decode(second.frames().get(0));
      assertThat(sent.type()).isEqualTo(CommandType.TYPE);
      assertThat(sent.tabId()).isEqualTo(2);
      assertThat(sent.selector()).isEqualTo("#q");
      assertThat(sent.text()).isEqualTo("hello");
      assertThat(sent.requestId()).startsWith("type-");

      service.send("c1", CommandType.NAVIGATE, builder -> builder.url("https://example.org"));
      assertThat(first.frames()).hasSize(1);
      CommandEnvelope navigate = CommandEnvelope.decode(first.frames().get(0));
      assertThat(navigate.requestId()).isNotEqualTo(sent.requestId());
      assertThat(navigate.url()).isEqualTo("https://example.org");
   }

   @Test
   public void testCachedContext(VertxTestContext ctx) {
      RecordingSocket socket = connect("c1", 1);
      PageContext cached = PageContext.of("https://example.com/c1", "Cached");
      registry.updateContext("c1", cached);
      service.context("c1", false).onComplete(ctx.succeeding(context -> ctx.verify(() -> {
         assertThat(context).isEqualTo(cached);
         assertThat(socket.frames()).isEmpty();
         ctx.completeNow();
      })));
   }

   @Test
   public void testRefreshContext(VertxTestContext ctx) {
      RecordingSocket socket = connect("c1", 1);
      Future<PageContext> refreshed = service.context("c1", true);
      CommandEnvelope request = CommandEnvelope.decode(socket.frames().get(0));
      assertThat(request.type()).isEqualTo(CommandType.GET_CONTEXT);

      registry.resolveCommand("c1", request.requestId(),
            new JsonObject().put("url", "https://example.com/fresh").put("title", "Fresh"));
      refreshed.onComplete(ctx.succeeding(context -> ctx.verify(() -> {
         assertThat(context.title()).isEqualTo("Fresh");
         assertThat(registry.get("c1").context().title()).isEqualTo("Fresh");
         assertThat(registry.get("c1").url()).isEqualTo("https://example.com/fresh");
         ctx.completeNow();
      })));
   }

   @Test
   public void testDescribeTabs() {
      connect("c1", 1);
      connect("c2", 2);
      assertThat(service.describeTabs()).hasSize(2);
      assertThat(service.describeTabs().getJsonObject(1).getString("id")).isEqualTo("c2");
   }
}
