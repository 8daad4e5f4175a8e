package dev.pluginlink.transport;

/**
 * The peer sent something the protocol does not allow, for example a first message other than
 * a registration. The stream is unusable afterwards.
 */
public class ProtocolViolationException extends PluginLinkException {

    public ProtocolViolationException(String message) {
        super(message);
    }

    public ProtocolViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
