package dev.pluginlink.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Objects;

/**
 * Converts envelopes to and from their serialized bytes.
 */
public final class EnvelopeCodec {

    private final ObjectMapper mapper;

    public EnvelopeCodec() {
        this(new ObjectMapper());
    }

    public EnvelopeCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public byte[] encode(Envelope envelope) throws IOException {
        Objects.requireNonNull(envelope, "envelope");
        return mapper.writeValueAsBytes(envelope);
    }

    public Envelope decode(byte[] bytes) throws EnvelopeDecodeException {
        if (bytes == null || bytes.length == 0) {
            throw new EnvelopeDecodeException("Empty envelope");
        }
        Envelope envelope;
        try {
            envelope = mapper.readValue(bytes, Envelope.class);
        } catch (IOException e) {
            throw new EnvelopeDecodeException("Invalid envelope: " + e.getMessage(), e);
        }
        if (envelope == null) {
            throw new EnvelopeDecodeException("Envelope is null");
        }
        return envelope;
    }
}
