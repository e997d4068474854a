package io.pincer.host;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import io.vertx.core.Vertx;

public class Pincer {
   private static final Logger log = LogManager.getLogger(Pincer.class);

   public static void main(String[] args) {
      Thread.setDefaultUncaughtExceptionHandler(Pincer::defaultUncaughtExceptionHandler);
      log.info("Java: {} {} {}",
            System.getProperty("java.vm.vendor", "<unknown VM vendor>"),
            System.getProperty("java.vm.name", "<unknown VM name>"),
            System.getProperty("java.version", "<unknown version>"));
      System.getProperties().forEach((n, value) -> {
         String name = String.valueOf(n);
         if (name.startsWith("io.pincer.") && !name.contains("token")) {
            log.debug("System property {} = {}", name, value);
         }
      });
      Vertx vertx = Vertx.vertx();
      vertx.deployVerticle(new HostVerticle()).onComplete(event -> {
         if (event.succeeded()) {
            log.info("{} deployed.", HostVerticle.class.getSimpleName());
         } else {
            log.error("Failed to deploy " + HostVerticle.class.getSimpleName(), event.cause());
            System.exit(1);
         }
      });
      Runtime.getRuntime().addShutdownHook(new Thread(() -> vertx.close().toCompletionStage().toCompletableFuture().join()));
   }

   private static void defaultUncaughtExceptionHandler(Thread thread, Throwable throwable) {
      log.error(new FormattedMessage("Uncaught exception in thread {}({})", thread.getName(), thread.getId()), throwable);
   }
}
