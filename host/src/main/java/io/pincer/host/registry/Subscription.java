package io.pincer.host.registry;

@FunctionalInterface
public interface Subscription {
   void unsubscribe();
}
