package dev.pluginlink.transport;

/**
 * A call reached the remote side and was answered with an error envelope.
 */
public class RemoteCallException extends Exception {

    private final String code;

    public RemoteCallException(String code, String message) {
        super(message);
        this.code = code;
    }

    public static RemoteCallException from(Envelope.RpcError error) {
        return new RemoteCallException(error.code(), error.message());
    }

    public String code() {
        return code;
    }

    @Override
    public String toString() {
        return "RemoteCallException[" + code + "]: " + getMessage();
    }
}
