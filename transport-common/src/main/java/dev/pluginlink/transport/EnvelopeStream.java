package dev.pluginlink.transport;

import java.io.Closeable;
import java.io.IOException;

/**
 * Ordered, reliable, bidirectional channel of envelopes between one plugin and the host.
 *
 * <p>{@link #receive()} is called from a single reader thread. Implementations are not required
 * to tolerate concurrent {@link #send(Envelope)} calls; callers that write from several threads
 * serialize their writes.
 */
public interface EnvelopeStream extends Closeable {

    void send(Envelope envelope) throws IOException;

    /**
     * Blocks until the next envelope arrives.
     * @return the envelope, or {@code null} once the remote side has finished sending
     * @throws EnvelopeDecodeException if the received bytes are not an envelope
     */
    Envelope receive() throws IOException;

    /**
     * Identifier used in log output.
     */
    String connectionId();
}
