package dev.pluginlink.transport;

import java.io.IOException;

/**
 * Base type for failures of the plugin stream protocol itself, as opposed to failures reported
 * by a remote method implementation.
 */
public class PluginLinkException extends IOException {

    public PluginLinkException(String message) {
        super(message);
    }

    public PluginLinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
