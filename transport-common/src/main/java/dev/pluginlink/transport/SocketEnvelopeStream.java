package dev.pluginlink.transport;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.SocketAddress;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.util.Objects;

/**
 * Envelope stream over a connected TCP or Unix domain socket channel, one length-prefixed frame
 * per envelope. The channel must be in blocking mode.
 */
public class SocketEnvelopeStream implements EnvelopeStream, HalfCloseable {

    private final SocketChannel channel;
    private final InputStream in;
    private final OutputStream out;
    private final String connectionId;
    private final EnvelopeCodec codec;
    private final int maxMessageSize;
    private final Object writeLock = new Object();

    private volatile boolean outputShutdown;
    private volatile boolean closed;

    public SocketEnvelopeStream(SocketChannel channel, EnvelopeCodec codec, int maxMessageSize) throws IOException {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.maxMessageSize = maxMessageSize;
        this.in = new ChannelInputStream(channel);
        this.out = new ChannelOutputStream(channel);
        this.connectionId = describe(channel);
    }

    private static String describe(SocketChannel channel) throws IOException {
        SocketAddress remote = channel.getRemoteAddress();
        if (remote instanceof UnixDomainSocketAddress unix && unix.getPath().toString().isEmpty()) {
            // the accepting side of a unix socket sees an unnamed peer
            return "unix:" + channel.getLocalAddress();
        }
        return String.valueOf(remote);
    }

    /**
     * Reads the header frame a plugin writes before its first envelope.
     */
    public ConnectionPreface readPreface() throws IOException {
        return ConnectionPreface.readFrom(in, maxMessageSize);
    }

    public void writePreface(ConnectionPreface preface) throws IOException {
        synchronized (writeLock) {
            preface.writeTo(out, maxMessageSize);
        }
    }

    @Override
    public void send(Envelope envelope) throws IOException {
        if (closed || outputShutdown) {
            throw new StreamClosedException("Stream " + connectionId + " is closed");
        }
        byte[] frame = codec.encode(envelope);
        Wire.tx(connectionId, envelope);
        synchronized (writeLock) {
            LengthPrefixedCodec.writeFrame(out, frame, maxMessageSize);
        }
    }

    @Override
    public Envelope receive() throws IOException {
        byte[] frame = LengthPrefixedCodec.readFrame(in, maxMessageSize);
        if (frame == null) {
            return null;
        }
        Envelope envelope = codec.decode(frame);
        Wire.rx(connectionId, envelope);
        return envelope;
    }

    @Override
    public void closeSend() throws IOException {
        synchronized (writeLock) {
            if (!closed && !outputShutdown) {
                outputShutdown = true;
                channel.shutdownOutput();
            }
        }
    }

    @Override
    public String connectionId() {
        return connectionId;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() throws IOException {
        closed = true;
        channel.close();
    }

    /**
     * Reads straight from the channel. Reads and writes on a socket channel take separate locks,
     * so a blocked reader does not stall writers.
     */
    private static final class ChannelInputStream extends InputStream {

        private final SocketChannel channel;

        ChannelInputStream(SocketChannel channel) {
            this.channel = channel;
        }

        @Override
        public int read() throws IOException {
            byte[] single = new byte[1];
            int read = read(single, 0, 1);
            return read == -1 ? -1 : single[0] & 0xff;
        }

        @Override
        public int read(byte[] buffer, int offset, int length) throws IOException {
            Objects.checkFromIndexSize(offset, length, buffer.length);
            if (length == 0) {
                return 0;
            }
            return channel.read(ByteBuffer.wrap(buffer, offset, length));
        }
    }

    private static final class ChannelOutputStream extends OutputStream {

        private final SocketChannel channel;

        ChannelOutputStream(SocketChannel channel) {
            this.channel = channel;
        }

        @Override
        public void write(int b) throws IOException {
            write(new byte[] {(byte) b}, 0, 1);
        }

        @Override
        public void write(byte[] buffer, int offset, int length) throws IOException {
            ByteBuffer data = ByteBuffer.wrap(buffer, offset, length);
            while (data.hasRemaining()) {
                channel.write(data);
            }
        }
    }
}
