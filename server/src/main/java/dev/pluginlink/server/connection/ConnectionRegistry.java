package dev.pluginlink.server.connection;

import dev.pluginlink.server.channel.PluginChannel;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks the plugins currently attached to the host and bounds how many may be attached at once.
 *
 * <p>Entries are keyed by plugin name. A plugin registering under a name that is already attached
 * replaces the existing entry; the stale stream keeps running until it ends on its own, and its
 * release does not evict the replacement.
 */
public class ConnectionRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionRegistry.class);

    public static final int DEFAULT_MAX_CONNECTIONS = 100;

    private final int maxConnections;
    private final ConnectionListener listener;
    private final Clock clock;
    private final Map<String, PluginConnection> connections = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /** Slots held by admissions whose connect callback is still running. Guarded by the write lock. */
    private int reserved;

    public ConnectionRegistry() {
        this(DEFAULT_MAX_CONNECTIONS);
    }

    public ConnectionRegistry(int maxConnections) {
        this(maxConnections, ConnectionListener.NOOP);
    }

    public ConnectionRegistry(int maxConnections, ConnectionListener listener) {
        this(maxConnections, listener, Clock.systemUTC());
    }

    public ConnectionRegistry(int maxConnections, ConnectionListener listener, Clock clock) {
        if (maxConnections <= 0) {
            throw new IllegalArgumentException("maxConnections must be positive: " + maxConnections);
        }
        this.maxConnections = maxConnections;
        this.listener = Objects.requireNonNull(listener, "listener");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Attaches {@code pluginName} for as long as {@code lifetime} is incomplete, then detaches it.
     * Returns normally when the lifetime completes normally or is cancelled.
     *
     * @throws MaxConnectionsReachedException if the registry is full; nothing was attached
     * @throws PluginConnectException if the connect callback failed; nothing remains attached
     * @throws ExecutionException if the lifetime completed exceptionally, carrying its cause
     * @throws InterruptedException if the waiting thread was interrupted; the plugin is detached
     */
    public void attach(String pluginName, CompletableFuture<?> lifetime)
        throws PluginAdmissionException, ExecutionException, InterruptedException {
        Objects.requireNonNull(lifetime, "lifetime");
        PluginConnection connection = admit(pluginName, null, null);
        try {
            lifetime.get();
        } catch (CancellationException e) {
            LOGGER.debug("Lifetime of plugin {} cancelled", pluginName);
        } finally {
            release(connection);
        }
    }

    /**
     * Admits a plugin: reserves a slot, runs the connect callback, then inserts the entry. A
     * reserved slot counts against the capacity while the callback runs, and an entry being
     * replaced stays visible until the callback succeeds. The caller owns the returned
     * connection and must hand it to {@link #release(PluginConnection)} when the stream ends.
     */
    public PluginConnection admit(String pluginName, String version, PluginChannel channel)
        throws PluginAdmissionException {
        Objects.requireNonNull(pluginName, "pluginName");
        lock.writeLock().lock();
        try {
            if (connections.size() + reserved >= maxConnections) {
                LOGGER.info("Max connections reached, rejecting plugin {}", pluginName);
                throw new MaxConnectionsReachedException(pluginName, maxConnections);
            }
            reserved++;
        } finally {
            lock.writeLock().unlock();
        }

        try {
            listener.onConnect(pluginName);
        } catch (Exception e) {
            LOGGER.error("Connection handler failed for plugin {}", pluginName, e);
            lock.writeLock().lock();
            try {
                reserved--;
            } finally {
                lock.writeLock().unlock();
            }
            throw new PluginConnectException(pluginName, e);
        }

        PluginConnection connection = new PluginConnection(pluginName, version, clock.instant(), channel);
        PluginConnection previous;
        lock.writeLock().lock();
        try {
            reserved--;
            previous = connections.put(pluginName, connection);
        } finally {
            lock.writeLock().unlock();
        }
        if (previous != null) {
            LOGGER.warn("Plugin {} registered again, replacing connection from {}", pluginName, previous.connectedAt());
        }
        LOGGER.info("Plugin registered: {} (version {})", pluginName, version);
        return connection;
    }

    /**
     * Removes the connection, fires its close signal and the disconnect callback. Calling it again
     * for the same connection does nothing.
     */
    public void release(PluginConnection connection) {
        if (connection.isClosed()) {
            return;
        }
        lock.writeLock().lock();
        try {
            connections.remove(connection.name(), connection);
        } finally {
            lock.writeLock().unlock();
        }
        if (!connection.markClosed()) {
            return;
        }
        LOGGER.info("Plugin unregistered: {}", connection.name());
        try {
            listener.onDisconnect(connection.name());
        } catch (Exception e) {
            LOGGER.warn("Disconnect handler failed for plugin {}", connection.name(), e);
        }
    }

    public boolean isAttached(String pluginName) {
        lock.readLock().lock();
        try {
            return connections.containsKey(pluginName);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> list() {
        lock.readLock().lock();
        try {
            return Set.copyOf(connections.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int count() {
        lock.readLock().lock();
        try {
            return connections.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<PluginConnectionInfo> info(String pluginName) {
        PluginConnection connection = get(pluginName);
        if (connection == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        return Optional.of(new PluginConnectionInfo(connection.name(), connection.version(),
            connection.connectedAt(), connection.lastMessageAt(), Duration.between(connection.connectedAt(), now)));
    }

    /**
     * Call channel of an attached plugin.
     */
    public Optional<PluginChannel> channel(String pluginName) {
        PluginConnection connection = get(pluginName);
        return connection == null ? Optional.empty() : connection.channel();
    }

    /**
     * Records activity on the plugin's stream. Does nothing for unknown names.
     */
    public void touch(String pluginName) {
        PluginConnection connection = get(pluginName);
        if (connection != null) {
            connection.touch(clock.instant());
        }
    }

    public int maxConnections() {
        return maxConnections;
    }

    private PluginConnection get(String pluginName) {
        lock.readLock().lock();
        try {
            return connections.get(pluginName);
        } finally {
            lock.readLock().unlock();
        }
    }
}
