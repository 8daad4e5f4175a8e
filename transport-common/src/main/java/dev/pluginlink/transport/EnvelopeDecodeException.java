package dev.pluginlink.transport;

public class EnvelopeDecodeException extends ProtocolViolationException {

    public EnvelopeDecodeException(String message) {
        super(message);
    }

    public EnvelopeDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
