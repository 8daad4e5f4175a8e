package dev.pluginlink.server.connection;

import dev.pluginlink.server.channel.PluginChannel;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry of the {@link ConnectionRegistry} for one admitted plugin stream.
 */
public final class PluginConnection {

    private final String name;
    private final String version;
    private final Instant connectedAt;
    private final PluginChannel channel;
    private final CompletableFuture<Void> closeSignal = new CompletableFuture<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    private volatile Instant lastMessageAt;

    PluginConnection(String name, String version, Instant connectedAt, PluginChannel channel) {
        this.name = name;
        this.version = version;
        this.connectedAt = connectedAt;
        this.lastMessageAt = connectedAt;
        this.channel = channel;
    }

    public String name() {
        return name;
    }

    public String version() {
        return version;
    }

    public Instant connectedAt() {
        return connectedAt;
    }

    public Instant lastMessageAt() {
        return lastMessageAt;
    }

    void touch(Instant now) {
        this.lastMessageAt = now;
    }

    public Optional<PluginChannel> channel() {
        return Optional.ofNullable(channel);
    }

    /**
     * Completes once the connection has been removed from the registry.
     */
    public CompletableFuture<Void> closeSignal() {
        return closeSignal.copy();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * @return {@code true} for the call that actually closed the connection
     */
    boolean markClosed() {
        if (closed.compareAndSet(false, true)) {
            closeSignal.complete(null);
            return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "PluginConnection[" + name + "@" + version + ", connectedAt=" + connectedAt + "]";
    }
}
