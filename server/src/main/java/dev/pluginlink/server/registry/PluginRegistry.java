package dev.pluginlink.server.registry;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lookup of {@link PluginProvider}s by name. Independent of which plugins are connected; see
 * {@link dev.pluginlink.server.connection.ConnectionRegistry} for that.
 */
public class PluginRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(PluginRegistry.class);

    private final Map<String, PluginProvider> plugins = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Registers {@code provider} under {@code name}, replacing any provider already there.
     */
    public void register(String name, PluginProvider provider) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(provider, "provider");
        lock.writeLock().lock();
        try {
            LOGGER.info("Registering plugin {}", name);
            plugins.put(name, provider);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void register(PluginProvider provider) {
        register(provider.name(), provider);
    }

    public void unregister(String name) {
        lock.writeLock().lock();
        try {
            LOGGER.info("Unregistering plugin {}", name);
            plugins.remove(name);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<PluginProvider> get(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(plugins.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, PluginProvider> getAll() {
        lock.readLock().lock();
        try {
            return Map.copyOf(plugins);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> list() {
        lock.readLock().lock();
        try {
            return Set.copyOf(plugins.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int count() {
        lock.readLock().lock();
        try {
            return plugins.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
