package dev.pluginlink.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs envelope traffic in one format on both ends of a stream, so host and plugin logs can be
 * read side by side.
 */
public final class Wire {

    private static final Logger LOGGER = LoggerFactory.getLogger("WIRE");

    private Wire() {
    }

    public static void rx(String connectionId, Envelope envelope) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("RX conn={} {}", connectionId, describe(envelope));
        }
    }

    public static void tx(String connectionId, Envelope envelope) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("TX conn={} {}", connectionId, describe(envelope));
        }
    }

    static String describe(Envelope envelope) {
        if (envelope instanceof Envelope.Register register) {
            return "type=register name=" + register.name() + " version=" + register.version();
        }
        if (envelope instanceof Envelope.RpcCall call) {
            return "type=rpc_call req=" + call.requestId() + " method=" + call.method()
                + " bytes=" + call.payload().length;
        }
        if (envelope instanceof Envelope.RpcResponse response) {
            return "type=rpc_response req=" + response.requestId() + " bytes=" + response.payload().length;
        }
        Envelope.RpcError error = (Envelope.RpcError) envelope;
        return "type=error req=" + error.requestId() + " code=" + error.code()
            + " message=" + truncate(error.message(), 200);
    }

    public static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "…";
    }
}
