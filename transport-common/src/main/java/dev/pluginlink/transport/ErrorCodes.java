package dev.pluginlink.transport;

/**
 * Codes carried by {@link Envelope.RpcError}.
 */
public final class ErrorCodes {

    /** The method implementation failed. */
    public static final String RPC_ERROR = "RPC_ERROR";

    /** A request or response payload could not be converted. */
    public static final String MARSHAL_ERROR = "MARSHAL_ERROR";

    /** No method with the requested name. */
    public static final String UNIMPLEMENTED = "Unimplemented";

    public static final String INVALID_ARGUMENT = "INVALID_ARGUMENT";

    public static final String RESOURCE_EXHAUSTED = "RESOURCE_EXHAUSTED";

    public static final String INTERNAL = "INTERNAL";

    /** The connection did not present the bearer token the host requires. */
    public static final String UNAUTHENTICATED = "UNAUTHENTICATED";

    private ErrorCodes() {
    }
}
