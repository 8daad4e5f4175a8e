package dev.pluginlink.server.connection;

import dev.pluginlink.transport.PluginLinkException;

public class PluginNotFoundException extends PluginLinkException {

    public PluginNotFoundException(String pluginName) {
        super("plugin not found: " + pluginName);
    }
}
