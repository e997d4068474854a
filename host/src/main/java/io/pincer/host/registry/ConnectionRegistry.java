package io.pincer.host.registry;

import java.util.List;

import io.pincer.api.context.PageContext;
import io.pincer.api.protocol.CommandEnvelope;
import io.vertx.core.Future;

/**
 * Live tab connections of the host and the commands outstanding on them.
 * <p>
 * All operations are safe to call from any thread; mutations are serialized. Lookups return
 * {@code null} when the connection is absent.
 */
public interface ConnectionRegistry {

   /**
    * Inserts a new connection. The id must not collide with a live connection.
    */
   void add(TabConnection connection);

   /**
    * Removes the connection and fails every request pending on it with
    * {@link io.pincer.api.connection.ConnectionClosedException}. Unknown ids are ignored.
    */
   void remove(String id);

   TabConnection get(String id);

   /**
    * @return the first connection bound to {@code tabId} in insertion order.
    */
   TabConnection getByTabId(int tabId);

   /**
    * @return immutable snapshot; later changes to the registry are not reflected.
    */
   List<TabConnection> list();

   /**
    * @return the connection with the most recent activity. Ties are broken arbitrarily.
    */
   TabConnection getActive();

   /**
    * Replaces the cached context, refreshes url/title and activity, then notifies the listeners in
    * registration order. Does nothing if the connection is absent.
    * <p>
    * Concurrent updates are delivered one at a time, in the order they were stored, so the last
    * notification always carries the cached context. Listeners must not wait for another thread
    * that is itself updating context.
    */
   void updateContext(String id, PageContext context);

   /**
    * Binds the connection to a tab. The first binding wins; later attempts with another tab id are
    * refused.
    *
    * @return {@code true} if the connection is (now) bound to {@code tabId}.
    */
   boolean bindTab(String id, int tabId, String url);

   /**
    * Records inbound traffic on the connection.
    */
   void touch(String id);

   /**
    * Sends the command and returns a future completed with the {@code command_result} payload.
    * Fails immediately with {@link io.pincer.api.connection.ConnectionNotFoundException} or
    * {@link io.pincer.api.connection.ConnectionNotOpenException}; later with
    * {@link io.pincer.api.connection.CommandTimeoutException} or
    * {@link io.pincer.api.connection.ConnectionClosedException}.
    */
   Future<Object> sendCommand(String id, CommandEnvelope command);

   /**
    * Completes the command sent as {@code requestId} on connection {@code id}.
    *
    * @return {@code false} for late, duplicate or unknown results.
    */
   boolean resolveCommand(String id, String requestId, Object result);

   Subscription onContextUpdate(ContextListener listener);

   int size();

   int pendingCount();

   /**
    * Removes all connections.
    */
   void close();
}
