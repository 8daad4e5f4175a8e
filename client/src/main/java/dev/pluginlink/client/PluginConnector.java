package dev.pluginlink.client;

import dev.pluginlink.transport.ConnectionPreface;
import dev.pluginlink.transport.EnvelopeCodec;
import dev.pluginlink.transport.SocketEnvelopeStream;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.StandardProtocolFamily;
import java.net.StandardSocketOptions;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.SocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens a plugin's connection to the host, over TCP or a Unix domain socket, and registers it.
 */
public final class PluginConnector {

    private static final Logger LOGGER = LoggerFactory.getLogger(PluginConnector.class);

    private PluginConnector() {
    }

    /**
     * Connects, presents the token when a token source is configured, and sends the plugin's
     * registration. The token source is consulted once; if it fails nothing is opened.
     *
     * @throws IOException if the token could not be obtained, the host is unreachable, or the
     *     registration could not be sent
     */
    public static PluginClient connect(ClientOptions options, MethodTable methods) throws IOException {
        String token = null;
        if (options.tokenProvider() != null) {
            try {
                token = options.tokenProvider().getToken();
            } catch (IOException e) {
                throw new IOException("failed to validate token provider: " + e.getMessage(), e);
            }
        }

        SocketChannel channel = options.socketPath() != null
            ? SocketChannel.open(StandardProtocolFamily.UNIX)
            : SocketChannel.open();
        try {
            if (options.socketPath() != null) {
                channel.connect(UnixDomainSocketAddress.of(options.socketPath()));
            } else {
                channel.socket().connect(new InetSocketAddress(options.host(), options.port()),
                    Math.toIntExact(options.connectTimeout().toMillis()));
                channel.setOption(StandardSocketOptions.TCP_NODELAY, true);
            }
            SocketEnvelopeStream stream = new SocketEnvelopeStream(channel, new EnvelopeCodec(), options.maxMessageSize());
            stream.writePreface(token == null ? ConnectionPreface.empty() : ConnectionPreface.withBearerToken(token));
            PluginDispatcher dispatcher = new PluginDispatcher(stream, options.pluginName(), options.pluginVersion(),
                methods, options.maxConcurrentCalls());
            LOGGER.info("Connected plugin {} to {}", options.pluginName(), options.endpoint());
            return new PluginClient(channel, dispatcher);
        } catch (IOException e) {
            try {
                channel.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }
}
