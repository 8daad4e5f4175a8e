package dev.pluginlink.server.transport;

import dev.pluginlink.server.channel.PluginChannel;
import dev.pluginlink.server.connection.ConnectionRegistry;
import dev.pluginlink.server.connection.MaxConnectionsReachedException;
import dev.pluginlink.server.connection.PluginAdmissionException;
import dev.pluginlink.server.connection.PluginConnectException;
import dev.pluginlink.server.connection.PluginConnection;
import dev.pluginlink.transport.Envelope;
import dev.pluginlink.transport.EnvelopeDecodeException;
import dev.pluginlink.transport.EnvelopeStream;
import dev.pluginlink.transport.ErrorCodes;
import dev.pluginlink.transport.PayloadCodec;
import dev.pluginlink.transport.ProtocolViolationException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the host side of one plugin stream from registration to detach, independent of the
 * transport the stream travels on.
 *
 * <ol>
 *   <li>The first envelope must be a {@link Envelope.Register} with a non-blank name.</li>
 *   <li>The plugin is admitted through the {@link ConnectionRegistry}.</li>
 *   <li>The calling thread runs the channel's receive loop until the stream ends.</li>
 *   <li>The plugin is released and the stream closed.</li>
 * </ol>
 *
 * Rejections are reported to the plugin as an error envelope without request id before the
 * stream is closed.
 */
public class PluginStreamHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(PluginStreamHandler.class);

    private final ConnectionRegistry registry;
    private final PayloadCodec payloadCodec;
    private final Set<PluginChannel> channels = ConcurrentHashMap.newKeySet();

    public PluginStreamHandler(ConnectionRegistry registry) {
        this(registry, new PayloadCodec());
    }

    public PluginStreamHandler(ConnectionRegistry registry, PayloadCodec payloadCodec) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.payloadCodec = Objects.requireNonNull(payloadCodec, "payloadCodec");
    }

    /**
     * Serves {@code stream} until it ends. Always closes the stream before returning.
     *
     * @throws ProtocolViolationException if the plugin did not register properly
     * @throws PluginAdmissionException if the registry refused the plugin
     * @throws IOException if the transport failed
     */
    public void handle(EnvelopeStream stream) throws IOException, PluginAdmissionException {
        handle(stream, () -> {
        });
    }

    /**
     * Like {@link #handle(EnvelopeStream)}, running {@code onAdmitted} once the registry has
     * admitted the plugin and before its calls are served.
     */
    public void handle(EnvelopeStream stream, Runnable onAdmitted) throws IOException, PluginAdmissionException {
        try (stream) {
            Envelope.Register register = awaitRegistration(stream);
            String name = register.name();
            LOGGER.info("Plugin attempting to connect: {} version {} on {}", name, register.version(),
                stream.connectionId());

            PluginChannel channel = new PluginChannel(stream, name, payloadCodec, () -> registry.touch(name));
            PluginConnection connection;
            try {
                connection = registry.admit(name, register.version(), channel);
            } catch (MaxConnectionsReachedException e) {
                reject(stream, ErrorCodes.RESOURCE_EXHAUSTED, e.getMessage());
                throw e;
            } catch (PluginConnectException e) {
                reject(stream, ErrorCodes.INTERNAL, e.getMessage());
                throw e;
            }

            channels.add(channel);
            try {
                onAdmitted.run();
                channel.listen();
            } finally {
                channels.remove(channel);
                channel.close();
                registry.release(connection);
                LOGGER.info("Plugin stream closed: {}", name);
            }
        }
    }

    private Envelope.Register awaitRegistration(EnvelopeStream stream) throws IOException {
        Envelope first;
        try {
            first = stream.receive();
        } catch (EnvelopeDecodeException e) {
            reject(stream, ErrorCodes.INVALID_ARGUMENT, "failed to decode plugin registration");
            throw e;
        }
        if (first == null) {
            throw new ProtocolViolationException("Stream " + stream.connectionId() + " closed before plugin registration");
        }
        if (!(first instanceof Envelope.Register register)) {
            reject(stream, ErrorCodes.INVALID_ARGUMENT, "first message must be Register");
            throw new ProtocolViolationException("First message must be Register, got "
                + first.getClass().getSimpleName());
        }
        if (register.name() == null || register.name().isBlank()) {
            reject(stream, ErrorCodes.INVALID_ARGUMENT, "plugin name cannot be empty");
            throw new ProtocolViolationException("Plugin name cannot be empty");
        }
        return register;
    }

    private void reject(EnvelopeStream stream, String code, String message) {
        try {
            stream.send(Envelope.error(null, code, message));
        } catch (IOException e) {
            LOGGER.debug("Could not deliver rejection {} to {}: {}", code, stream.connectionId(), e.getMessage());
        }
    }

    /**
     * Closes every stream currently being served; their {@link #handle} calls return normally.
     */
    public void closeAll() {
        for (PluginChannel channel : new ArrayList<>(channels)) {
            try {
                channel.close();
            } catch (IOException e) {
                LOGGER.warn("Error closing stream of plugin {}", channel.pluginName(), e);
            }
        }
    }

    public int activeStreams() {
        return channels.size();
    }
}
