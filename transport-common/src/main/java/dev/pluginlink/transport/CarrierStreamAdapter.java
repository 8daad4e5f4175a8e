package dev.pluginlink.transport;

import java.io.IOException;
import java.util.Objects;
import java.util.function.Function;

/**
 * Runs the envelope protocol inside another protocol's messages. The envelope's bytes are placed
 * into a carrier with {@code wrap} on the way out and taken back out with {@code unwrap} on the
 * way in, so the protocol never depends on the carrier's schema.
 *
 * <pre>{@code
 * EnvelopeStream stream = new CarrierStreamAdapter<>(jobStream, "job-7",
 *     bytes -> new JobMessage(bytes),
 *     JobMessage::data);
 * }</pre>
 *
 * @param <C> carrier message type
 */
public class CarrierStreamAdapter<C> implements EnvelopeStream, HalfCloseable {

    private final CarrierStream<C> carrierStream;
    private final String connectionId;
    private final Function<byte[], C> wrap;
    private final Function<C, byte[]> unwrap;
    private final EnvelopeCodec codec;

    public CarrierStreamAdapter(CarrierStream<C> carrierStream, String connectionId,
                                Function<byte[], C> wrap, Function<C, byte[]> unwrap) {
        this(carrierStream, connectionId, wrap, unwrap, new EnvelopeCodec());
    }

    public CarrierStreamAdapter(CarrierStream<C> carrierStream, String connectionId,
                                Function<byte[], C> wrap, Function<C, byte[]> unwrap, EnvelopeCodec codec) {
        this.carrierStream = Objects.requireNonNull(carrierStream, "carrierStream");
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
        this.wrap = Objects.requireNonNull(wrap, "wrap");
        this.unwrap = Objects.requireNonNull(unwrap, "unwrap");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public void send(Envelope envelope) throws IOException {
        byte[] bytes = codec.encode(envelope);
        Wire.tx(connectionId, envelope);
        carrierStream.send(wrap.apply(bytes));
    }

    @Override
    public Envelope receive() throws IOException {
        C carrier = carrierStream.receive();
        if (carrier == null) {
            return null;
        }
        Envelope envelope = codec.decode(unwrap.apply(carrier));
        Wire.rx(connectionId, envelope);
        return envelope;
    }

    /**
     * Half-closes the carrier stream when it supports it, otherwise closes it.
     */
    @Override
    public void closeSend() throws IOException {
        if (carrierStream instanceof HalfCloseable halfCloseable) {
            halfCloseable.closeSend();
        } else {
            carrierStream.close();
        }
    }

    @Override
    public String connectionId() {
        return connectionId;
    }

    @Override
    public void close() throws IOException {
        carrierStream.close();
    }
}
