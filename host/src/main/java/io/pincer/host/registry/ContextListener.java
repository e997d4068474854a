package io.pincer.host.registry;

import io.pincer.api.context.PageContext;

@FunctionalInterface
public interface ContextListener {
   /**
    * Invoked synchronously after the registry stored {@code context}. Exceptions are logged and do
    * not affect the stored context or the other listeners.
    */
   void onContextUpdate(TabConnection connection, PageContext context);
}
