package dev.pluginlink.transport;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import java.util.Arrays;
import java.util.Objects;

/**
 * Unit of exchange on a plugin stream. Exactly one of four cases: the registration a plugin
 * announces itself with, a call, the response to a call, or an error.
 *
 * <p>Encoded as JSON with a {@code type} discriminator; byte payloads travel as base64.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Envelope.Register.class, name = "register"),
    @JsonSubTypes.Type(value = Envelope.RpcCall.class, name = "rpc_call"),
    @JsonSubTypes.Type(value = Envelope.RpcResponse.class, name = "rpc_response"),
    @JsonSubTypes.Type(value = Envelope.RpcError.class, name = "error")
})
public sealed interface Envelope
    permits Envelope.Register, Envelope.RpcCall, Envelope.RpcResponse, Envelope.RpcError {

    static Register register(String name, String version) {
        return new Register(name, version);
    }

    static RpcCall call(String requestId, String method, byte[] payload) {
        return new RpcCall(requestId, method, payload);
    }

    static RpcResponse response(String requestId, byte[] payload) {
        return new RpcResponse(requestId, payload);
    }

    static RpcError error(String requestId, String code, String message) {
        return new RpcError(requestId, code, message);
    }

    /**
     * First message on every stream.
     */
    @JsonTypeName("register")
    record Register(String name, String version) implements Envelope {
    }

    @JsonTypeName("rpc_call")
    record RpcCall(String requestId, String method, byte[] payload) implements Envelope {

        public RpcCall {
            payload = payload == null ? new byte[0] : payload;
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof RpcCall that
                && Objects.equals(requestId, that.requestId)
                && Objects.equals(method, that.method)
                && Arrays.equals(payload, that.payload);
        }

        @Override
        public int hashCode() {
            return 31 * Objects.hash(requestId, method) + Arrays.hashCode(payload);
        }

        @Override
        public String toString() {
            return "RpcCall[requestId=" + requestId + ", method=" + method + ", payload=" + payload.length + " bytes]";
        }
    }

    @JsonTypeName("rpc_response")
    record RpcResponse(String requestId, byte[] payload) implements Envelope {

        public RpcResponse {
            payload = payload == null ? new byte[0] : payload;
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof RpcResponse that
                && Objects.equals(requestId, that.requestId)
                && Arrays.equals(payload, that.payload);
        }

        @Override
        public int hashCode() {
            return 31 * Objects.hashCode(requestId) + Arrays.hashCode(payload);
        }

        @Override
        public String toString() {
            return "RpcResponse[requestId=" + requestId + ", payload=" + payload.length + " bytes]";
        }
    }

    /**
     * In-band failure. {@code requestId} is {@code null} for connection-level errors that do not
     * belong to a particular call.
     */
    @JsonTypeName("error")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record RpcError(String requestId, String code, String message) implements Envelope {
    }
}
