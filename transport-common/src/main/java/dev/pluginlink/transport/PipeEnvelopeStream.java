package dev.pluginlink.transport;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * In-process envelope stream. {@link #pair(String)} returns two connected ends; whatever one end
 * sends, the other receives, in order. Connects a host and a plugin without a socket.
 */
public final class PipeEnvelopeStream implements EnvelopeStream, HalfCloseable {

    private static final Object END_OF_STREAM = new Object();

    private final String connectionId;
    private final BlockingQueue<Object> inbound;
    private final BlockingQueue<Object> outbound;

    private volatile boolean sendClosed;
    private volatile boolean closed;

    private PipeEnvelopeStream(String connectionId, BlockingQueue<Object> inbound, BlockingQueue<Object> outbound) {
        this.connectionId = connectionId;
        this.inbound = inbound;
        this.outbound = outbound;
    }

    public static Pair pair(String name) {
        BlockingQueue<Object> toPlugin = new LinkedBlockingQueue<>();
        BlockingQueue<Object> toHost = new LinkedBlockingQueue<>();
        return new Pair(
            new PipeEnvelopeStream(name + "/host", toHost, toPlugin),
            new PipeEnvelopeStream(name + "/plugin", toPlugin, toHost));
    }

    @Override
    public void send(Envelope envelope) throws IOException {
        if (closed || sendClosed) {
            throw new StreamClosedException("Stream " + connectionId + " is closed");
        }
        Wire.tx(connectionId, envelope);
        outbound.add(envelope);
    }

    @Override
    public Envelope receive() throws IOException {
        Object item;
        try {
            item = inbound.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while receiving on " + connectionId);
        }
        if (item == END_OF_STREAM) {
            inbound.add(END_OF_STREAM);
            return null;
        }
        if (item instanceof IOException failure) {
            inbound.add(failure);
            throw failure;
        }
        Envelope envelope = (Envelope) item;
        Wire.rx(connectionId, envelope);
        return envelope;
    }

    /**
     * Makes this end's pending and future {@link #receive()} calls fail with {@code cause}, the
     * way a broken transport would.
     */
    public void fail(IOException cause) {
        inbound.add(cause);
    }

    @Override
    public void closeSend() {
        if (!sendClosed) {
            sendClosed = true;
            outbound.add(END_OF_STREAM);
        }
    }

    @Override
    public String connectionId() {
        return connectionId;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        closeSend();
        inbound.add(END_OF_STREAM);
    }

    /**
     * The two ends of a pipe.
     */
    public record Pair(PipeEnvelopeStream host, PipeEnvelopeStream plugin) {
    }
}
