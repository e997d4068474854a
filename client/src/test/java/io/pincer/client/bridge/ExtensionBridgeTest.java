package io.pincer.client.bridge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.pincer.api.config.ExtensionConfig;
import io.pincer.api.connection.ConnectionState;
import io.pincer.api.context.PageContext;
import io.pincer.api.protocol.CommandEnvelope;
import io.pincer.api.protocol.CommandType;
import io.pincer.api.protocol.EventEnvelope;
import io.pincer.api.protocol.EventType;
import io.pincer.api.protocol.MalformedMessageException;
import io.pincer.client.ConnectionListener;
import io.pincer.client.Gateway;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;

public class ExtensionBridgeTest {
   private FakeGateway gateway;
   private FakeDriver driver;
   private ExtensionBridge bridge;

   @BeforeEach
   public void before() {
      driver = new FakeDriver();
      bridge = new ExtensionBridge(ExtensionConfig.DEFAULT, driver, (config, listener) -> {
         gateway = new FakeGateway(config, listener);
         return gateway;
      });
   }

   @Test
   public void testAutoConnect() {
      bridge.start();
      assertThat(bridge.status()).isEqualTo(ConnectionState.CONNECTED);

      ExtensionBridge manual = new ExtensionBridge(ExtensionConfig.DEFAULT.merge(new JsonObject().put("autoConnect", false)),
            driver, FakeGateway::new);
      manual.start();
      assertThat(manual.status()).isEqualTo(ConnectionState.DISCONNECTED);
   }

   @Test
   public void testTabSwitchPublishesContext() {
      bridge.start();
      driver.context = PageContext.of("https://example.com/docs", "Docs");
      bridge.onTabActivated(4, "https://example.com/docs", "Docs");

      assertThat(driver.contextRequests).containsExactly(4);
      assertThat(gateway.sent).hasSize(1);
      EventEnvelope event = gateway.sent.get(0);
      assertThat(event.type()).isEqualTo(EventType.PAGE_CONTEXT);
      assertThat(event.tabId()).isEqualTo(4);
      assertThat(event.payloadObject().getString("title")).isEqualTo("Docs");
      assertThat(bridge.tabCount()).isEqualTo(1);
   }

   @Test
   public void testInternalPagesIgnored() {
      bridge.start();
      bridge.onTabActivated(1, "chrome://settings", "Settings");
      assertThat(bridge.tabCount()).isZero();
      assertThat(driver.contextRequests).isEmpty();
   }

   @Test
   public void testNoPublishWhenDisabledOrDisconnected() {
      bridge.onTabActivated(1, "https://example.com", "Example");
      assertThat(driver.contextRequests).isEmpty();
      assertThat(bridge.publishSelection(1, "https://example.com", "text")).isFalse();

      bridge.start();
      bridge.updateConfig(new JsonObject().put("sendOnTabSwitch", false));
      assertThat(gateway.config.sendOnTabSwitch()).isFalse();
      bridge.onTabActivated(2, "https://example.com/2", "Two");
      assertThat(driver.contextRequests).isEmpty();
      assertThat(bridge.tabCount()).isEqualTo(2);
   }

   @Test
   public void testTabTracking() {
      bridge.onTabUpdated(1, "https://example.com/loading", "", false);
      assertThat(bridge.tabCount()).isZero();
      bridge.onTabUpdated(1, "https://example.com/done", "Done", true);
      assertThat(bridge.tabs()).containsExactly(new TabInfo(1, "https://example.com/done", "Done"));
      bridge.onTabRemoved(1);
      assertThat(bridge.tabCount()).isZero();
   }

   @Test
   public void testCommandDispatched() {
      bridge.start();
      bridge.onTabUpdated(7, "https://example.com/form", "Form", true);
      driver.result = Future.succeededFuture(new JsonObject().put("ok", true));
      bridge.onCommand(CommandEnvelope.builder(CommandType.CLICK, "r1").tabId(7).ref("e3").build());

      assertThat(driver.executed).extracting(CommandEnvelope::requestId).containsExactly("r1");
      EventEnvelope result = gateway.sent.get(0);
      assertThat(result.type()).isEqualTo(EventType.COMMAND_RESULT);
      assertThat(result.requestId()).isEqualTo("r1");
      assertThat(result.tabId()).isEqualTo(7);
      assertThat(result.url()).isEqualTo("https://example.com/form");
      assertThat(result.payload()).isEqualTo(new JsonObject().put("ok", true));
   }

   @Test
   public void testCommandWithoutTabUsesActiveTab() {
      bridge.start();
      driver.activeTab = 9;
      driver.result = Future.succeededFuture("done");
      bridge.onCommand(CommandEnvelope.builder(CommandType.GET_SNAPSHOT, "r2").build());
      assertThat(gateway.sent.get(0).tabId()).isEqualTo(9);
      assertThat(gateway.sent.get(0).payload()).isEqualTo("done");
   }

   @Test
   public void testExecuteRejected() {
      bridge.start();
      bridge.onCommand(CommandEnvelope.builder(CommandType.EXECUTE, "r3").tabId(1).text("alert(1)").build());
      assertThat(driver.executed).isEmpty();
      JsonObject payload = gateway.sent.get(0).payloadObject();
      assertThat(payload.getBoolean("ok")).isFalse();
      assertThat(payload.getString("error")).contains("execute");
   }

   @Test
   public void testFailuresReported() {
      bridge.start();
      driver.result = Future.failedFuture(new IllegalStateException("element e9 not found"));
      bridge.onCommand(CommandEnvelope.builder(CommandType.CLICK, "r4").tabId(1).ref("e9").build());
      assertThat(gateway.sent.get(0).payloadObject().getString("error")).isEqualTo("element e9 not found");

      driver.activeTab = null;
      bridge.onCommand(CommandEnvelope.builder(CommandType.SCREENSHOT, "r5").build());
      assertThat(gateway.sent.get(1).requestId()).isEqualTo("r5");
      assertThat(gateway.sent.get(1).payloadObject().getBoolean("ok")).isFalse();
   }

   @Test
   public void testStatusBroadcast() {
      List<String> statuses = new ArrayList<>();
      bridge.addStatusListener((state, tabCount) -> statuses.add(state.label() + "/" + tabCount));
      bridge.addStatusListener((state, tabCount) -> {
         throw new IllegalStateException("popup closed");
      });
      bridge.onTabUpdated(1, "https://example.com", "Example", true);
      bridge.start();
      bridge.disconnect();
      assertThat(statuses).containsExactly("connected/1", "disconnected/1");
   }

   @Test
   public void testStatusJsonHidesToken() {
      bridge.updateConfig(new JsonObject().put("gateway", new JsonObject().put("token", "secret")));
      JsonObject status = bridge.statusJson();
      assertThat(status.getString("status")).isEqualTo("disconnected");
      assertThat(status.encode()).doesNotContain("secret");
      assertThat(bridge.config().token()).isEqualTo("secret");
   }

   @Test
   public void testInvalidConfigUpdateKeepsConfig() {
      ExtensionConfig before = bridge.config();
      assertThatThrownBy(() -> bridge.updateConfig(new JsonObject().put("sendOnTabSwitch", false).put("autoConnect", "yes")))
            .isInstanceOf(MalformedMessageException.class);
      assertThat(bridge.config()).isSameAs(before);
      assertThat(gateway.config).isSameAs(before);
   }

   static class FakeGateway implements Gateway {
      final ConnectionListener listener;
      final List<EventEnvelope> sent = new ArrayList<>();
      ConnectionState state = ConnectionState.DISCONNECTED;
      ExtensionConfig config;

      FakeGateway(ExtensionConfig config, ConnectionListener listener) {
         this(listener);
         this.config = config;
      }

      FakeGateway(ConnectionListener listener) {
         this.listener = listener;
      }

      @Override
      public void connect() {
         state = ConnectionState.CONNECTED;
         listener.onStatusChange(state);
      }

      @Override
      public void disconnect() {
         state = ConnectionState.DISCONNECTED;
         listener.onStatusChange(state);
      }

      @Override
      public boolean send(EventEnvelope message) {
         if (state != ConnectionState.CONNECTED) {
            return false;
         }
         sent.add(message);
         return true;
      }

      @Override
      public ConnectionState state() {
         return state;
      }

      @Override
      public void updateConfig(ExtensionConfig config) {
         this.config = config;
      }
   }

   static class FakeDriver implements TabDriver {
      final List<Integer> contextRequests = new ArrayList<>();
      final List<CommandEnvelope> executed = new ArrayList<>();
      Integer activeTab = 1;
      PageContext context;
      Future<Object> result = Future.succeededFuture(new JsonObject().put("ok", true));

      @Override
      public Future<Integer> activeTabId() {
         return Future.succeededFuture(activeTab);
      }

      @Override
      public Future<PageContext> requestContext(int tabId) {
         contextRequests.add(tabId);
         return context == null ? Future.failedFuture("no content script") : Future.succeededFuture(context);
      }

      @Override
      public Future<Object> execute(int tabId, CommandEnvelope command) {
         executed.add(command);
         return result;
      }
   }
}
