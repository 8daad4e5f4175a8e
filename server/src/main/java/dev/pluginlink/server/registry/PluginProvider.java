package dev.pluginlink.server.registry;

/**
 * Application-defined descriptor of a plugin the host knows about.
 */
public interface PluginProvider {

    String name();
}
