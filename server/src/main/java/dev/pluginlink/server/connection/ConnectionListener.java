package dev.pluginlink.server.connection;

/**
 * Lifecycle callbacks invoked by {@link ConnectionRegistry} when a plugin attaches or detaches.
 */
public interface ConnectionListener {

    ConnectionListener NOOP = new ConnectionListener() {
    };

    /**
     * Called once a slot is reserved for the plugin and before it becomes visible in the
     * registry. Throwing aborts the admission: the slot is freed, a connection the plugin would
     * have replaced stays in place, and {@link #onDisconnect(String)} is not called.
     */
    default void onConnect(String pluginName) throws Exception {
    }

    default void onDisconnect(String pluginName) throws Exception {
    }
}
