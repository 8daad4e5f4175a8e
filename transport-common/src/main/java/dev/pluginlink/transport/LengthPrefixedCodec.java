package dev.pluginlink.transport;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Frames consist of a four-byte big-endian length followed by that many payload bytes. Both
 * directions refuse frames above the caller's size limit.
 */
public final class LengthPrefixedCodec {

    /** 10 MiB. */
    public static final int DEFAULT_MAX_FRAME_SIZE = 10 * 1024 * 1024;

    private LengthPrefixedCodec() {
    }

    public static void writeFrame(OutputStream out, byte[] payload, int maxFrameSize) throws IOException {
        if (payload.length > maxFrameSize) {
            throw new IOException("Frame too large: " + payload.length + " > " + maxFrameSize);
        }
        byte[] header = ByteBuffer.allocate(4).order(ByteOrder.BIG_ENDIAN).putInt(payload.length).array();
        out.write(header);
        out.write(payload);
        out.flush();
    }

    /**
     * @return the frame payload, or {@code null} if the stream ended cleanly before a header
     */
    public static byte[] readFrame(InputStream in, int maxFrameSize) throws IOException {
        byte[] header = readFully(in, 4);
        if (header == null) {
            return null;
        }
        int length = ByteBuffer.wrap(header).order(ByteOrder.BIG_ENDIAN).getInt();
        if (length < 0) {
            throw new IOException("Invalid frame length: " + length);
        }
        if (length > maxFrameSize) {
            throw new IOException("Frame too large: " + length + " > " + maxFrameSize);
        }
        if (length == 0) {
            return new byte[0];
        }
        byte[] payload = readFully(in, length);
        if (payload == null) {
            throw new EOFException("Stream closed while reading frame payload of length " + length);
        }
        return payload;
    }

    private static byte[] readFully(InputStream in, int length) throws IOException {
        byte[] buffer = new byte[length];
        int offset = 0;
        while (offset < length) {
            int read = in.read(buffer, offset, length - offset);
            if (read == -1) {
                if (offset == 0) {
                    return null;
                }
                throw new EOFException("Unexpected end of stream after reading " + offset + " bytes");
            }
            offset += read;
        }
        return buffer;
    }
}
