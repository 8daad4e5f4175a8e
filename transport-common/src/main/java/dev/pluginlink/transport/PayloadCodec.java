package dev.pluginlink.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Objects;

/**
 * Serializes call arguments and results into envelope payloads. Raw {@code byte[]} values pass
 * through untouched; everything else is JSON.
 */
public final class PayloadCodec {

    private final ObjectMapper mapper;

    public PayloadCodec() {
        this(new ObjectMapper());
    }

    public PayloadCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public byte[] encode(Object value) throws IOException {
        if (value instanceof byte[] bytes) {
            return bytes;
        }
        return mapper.writeValueAsBytes(value);
    }

    public <T> T decode(byte[] payload, Class<T> type) throws IOException {
        if (type == byte[].class) {
            return type.cast(payload);
        }
        if (payload == null || payload.length == 0) {
            if (type == Void.class) {
                return null;
            }
            throw new IOException("Empty payload for " + type.getSimpleName());
        }
        return mapper.readValue(payload, type);
    }
}
