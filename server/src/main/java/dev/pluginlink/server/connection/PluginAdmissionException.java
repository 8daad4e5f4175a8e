package dev.pluginlink.server.connection;

/**
 * A plugin could not be attached.
 */
public class PluginAdmissionException extends Exception {

    private final String pluginName;

    public PluginAdmissionException(String pluginName, String message) {
        super(message);
        this.pluginName = pluginName;
    }

    public PluginAdmissionException(String pluginName, String message, Throwable cause) {
        super(message, cause);
        this.pluginName = pluginName;
    }

    public String pluginName() {
        return pluginName;
    }
}
