package dev.pluginlink.server.transport;

import dev.pluginlink.transport.PluginLinkException;

public class InvalidAddressException extends PluginLinkException {

    public InvalidAddressException(String message) {
        super(message);
    }
}
