package io.pincer.host;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.pincer.host.push.SystemEventSink;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;

public class HostVerticle extends AbstractVerticle {
   private static final Logger log = LogManager.getLogger(HostVerticle.class);

   private final SystemEventSink sink;
   private PincerHost host;

   public HostVerticle() {
      this((connectionId, text) -> log.info("[{}] {}", connectionId, text));
   }

   public HostVerticle(SystemEventSink sink) {
      this.sink = sink;
   }

   @Override
   public void start(Promise<Void> startPromise) {
      HostConfig config = HostConfig.from(config());
      log.info("Starting with {}", config);
      vertx.exceptionHandler(throwable -> log.error("Uncaught error: ", throwable));
      host = new PincerHost(vertx, config, sink);
      host.activate().<Void>mapEmpty().onComplete(startPromise);
   }

   @Override
   public void stop(Promise<Void> stopPromise) {
      if (host == null) {
         stopPromise.complete();
      } else {
         host.deactivate().onComplete(stopPromise);
      }
   }

   public PincerHost host() {
      return host;
   }
}
