package dev.pluginlink.server.connection;

/**
 * The {@link ConnectionListener#onConnect(String)} callback rejected the plugin.
 */
public class PluginConnectException extends PluginAdmissionException {

    public PluginConnectException(String pluginName, Throwable cause) {
        super(pluginName, "connection handler failed for plugin " + pluginName + ": " + cause.getMessage(), cause);
    }
}
