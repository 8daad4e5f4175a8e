package dev.pluginlink.transport;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Header frame a plugin writes before any envelope on a socket connection. Carries the bearer
 * token when the plugin is configured with one.
 */
public record ConnectionPreface(Map<String, String> headers) {

    public static final String AUTHORIZATION = "authorization";

    private static final String BEARER = "Bearer ";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final TypeReference<Map<String, String>> HEADERS_TYPE = new TypeReference<>() {
    };

    public ConnectionPreface {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static ConnectionPreface empty() {
        return new ConnectionPreface(Map.of());
    }

    public static ConnectionPreface withBearerToken(String token) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(AUTHORIZATION, BEARER + token);
        return new ConnectionPreface(headers);
    }

    public Optional<String> bearerToken() {
        String value = headers.get(AUTHORIZATION);
        if (value == null || !value.startsWith(BEARER)) {
            return Optional.empty();
        }
        return Optional.of(value.substring(BEARER.length()));
    }

    public void writeTo(OutputStream out, int maxFrameSize) throws IOException {
        LengthPrefixedCodec.writeFrame(out, MAPPER.writeValueAsBytes(headers), maxFrameSize);
    }

    public static ConnectionPreface readFrom(InputStream in, int maxFrameSize) throws IOException {
        byte[] frame = LengthPrefixedCodec.readFrame(in, maxFrameSize);
        if (frame == null) {
            throw new EOFException("Connection closed before preface");
        }
        Map<String, String> headers;
        try {
            headers = MAPPER.readValue(frame, HEADERS_TYPE);
        } catch (IOException e) {
            throw new ProtocolViolationException("Invalid connection preface", e);
        }
        if (headers == null) {
            throw new ProtocolViolationException("Invalid connection preface: expected a header object");
        }
        for (Map.Entry<String, String> header : headers.entrySet()) {
            if (header.getValue() == null) {
                throw new ProtocolViolationException("Invalid connection preface: header " + header.getKey()
                    + " has no value");
            }
        }
        return new ConnectionPreface(headers);
    }
}
