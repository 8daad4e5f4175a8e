package dev.pluginlink.server.connection;

public class MaxConnectionsReachedException extends PluginAdmissionException {

    public MaxConnectionsReachedException(String pluginName, int maxConnections) {
        super(pluginName, "max plugin connections reached (" + maxConnections + ")");
    }
}
