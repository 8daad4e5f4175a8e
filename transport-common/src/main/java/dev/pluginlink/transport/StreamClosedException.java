package dev.pluginlink.transport;

/**
 * The stream ended before the operation could complete. Distinct from {@link RemoteCallException},
 * which means the remote side answered with an error.
 */
public class StreamClosedException extends PluginLinkException {

    public StreamClosedException(String message) {
        super(message);
    }

    public StreamClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
