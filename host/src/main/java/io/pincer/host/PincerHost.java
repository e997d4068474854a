package io.pincer.host;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.pincer.host.push.ContextPushListener;
import io.pincer.host.push.SystemEventSink;
import io.pincer.host.registry.ConnectionRegistry;
import io.pincer.host.registry.DefaultConnectionRegistry;
import io.pincer.host.registry.Subscription;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;

/**
 * Everything the host side needs, created on activation and handed to the components that need it.
 * There is no global state: two hosts in one JVM are independent.
 */
public class PincerHost {
   private static final Logger log = LogManager.getLogger(PincerHost.class);
   private static final String MIME_TYPE_JSON = "application/json";

   private final Vertx vertx;
   private final HostConfig config;
   private final SystemEventSink sink;
   private final ConnectionRegistry registry;
   private final TabCommandService commands;
   private HttpServer httpServer;
   private Subscription pushSubscription;

   public PincerHost(Vertx vertx, HostConfig config, SystemEventSink sink) {
      this.vertx = vertx;
      this.config = config;
      this.sink = sink;
      this.registry = new DefaultConnectionRegistry(vertx, config.requestTimeout());
      this.commands = new TabCommandService(registry);
   }

   public Future<PincerHost> activate() {
      if (!config.enabled()) {
         log.info("Pincer host disabled");
         return Future.succeededFuture(this);
      }
      if (config.pushContextOnSwitch() && sink != null) {
         pushSubscription = registry.onContextUpdate(new ContextPushListener(sink));
      }
      Router router = Router.router(vertx);
      PincerSocketHandler socketHandler = new PincerSocketHandler(registry);
      router.get(config.wsPath() + "/status").handler(this::status);
      router.get(config.wsPath()).handler(ctx -> ctx.request().toWebSocket()
            .onSuccess(socketHandler)
            .onFailure(cause -> {
               log.debug("Rejected non-upgrade request to {}: {}", config.wsPath(), cause.getMessage());
               if (!ctx.response().ended()) {
                  ctx.response().setStatusCode(400).end("WebSocket upgrade required");
               }
            }));
      return vertx.createHttpServer().requestHandler(router).listen(config.port(), config.host())
            .onSuccess(server -> {
               httpServer = server;
               log.info("Pincer host listening on {}:{}{}", config.host(), server.actualPort(), config.wsPath());
            })
            .onFailure(cause -> log.error("Cannot start Pincer host on " + config.host() + ":" + config.port(), cause))
            .map(this);
   }

   public Future<Void> deactivate() {
      if (pushSubscription != null) {
         pushSubscription.unsubscribe();
         pushSubscription = null;
      }
      registry.close();
      if (httpServer == null) {
         return Future.succeededFuture();
      }
      HttpServer server = httpServer;
      httpServer = null;
      return server.close().onComplete(result -> log.info("Pincer host stopped"));
   }

   private void status(RoutingContext ctx) {
      JsonObject status = new JsonObject()
            .put("tabs", registry.size())
            .put("pending", registry.pendingCount())
            .put("connections", commands.describeTabs());
      ctx.response().putHeader(HttpHeaders.CONTENT_TYPE, MIME_TYPE_JSON).end(status.encode());
   }

   public int actualPort() {
      return httpServer == null ? -1 : httpServer.actualPort();
   }

   public HostConfig config() {
      return config;
   }

   public ConnectionRegistry registry() {
      return registry;
   }

   public TabCommandService commands() {
      return commands;
   }
}
