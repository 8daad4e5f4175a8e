package dev.pluginlink.client;

import java.io.Closeable;
import java.io.IOException;
import java.nio.channels.SocketChannel;

/**
 * A plugin connected to its host.
 */
public class PluginClient implements Closeable {

    private final SocketChannel channel;
    private final PluginDispatcher dispatcher;

    PluginClient(SocketChannel channel, PluginDispatcher dispatcher) {
        this.channel = channel;
        this.dispatcher = dispatcher;
    }

    /**
     * Answers host calls until the host disconnects or {@link #shutdown()} is called.
     */
    public void serve() throws IOException {
        dispatcher.serve();
    }

    public void shutdown() {
        dispatcher.shutdown();
    }

    public String pluginName() {
        return dispatcher.pluginName();
    }

    public boolean isConnected() {
        return channel.isOpen() && channel.isConnected();
    }

    @Override
    public void close() throws IOException {
        try {
            dispatcher.close();
        } finally {
            channel.close();
        }
    }
}
