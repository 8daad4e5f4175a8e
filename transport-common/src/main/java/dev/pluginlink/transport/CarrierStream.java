package dev.pluginlink.transport;

import java.io.Closeable;
import java.io.IOException;

/**
 * Duplex stream of an application-specific carrier message type, one of whose fields holds the
 * serialized envelope.
 *
 * @param <C> carrier message type
 */
public interface CarrierStream<C> extends Closeable {

    void send(C message) throws IOException;

    /**
     * @return the next carrier, or {@code null} once the remote side has finished sending
     */
    C receive() throws IOException;
}
