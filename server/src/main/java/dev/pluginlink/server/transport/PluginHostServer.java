package dev.pluginlink.server.transport;

import dev.pluginlink.server.channel.PluginChannel;
import dev.pluginlink.server.connection.ConnectionRegistry;
import dev.pluginlink.server.connection.PluginAdmissionException;
import dev.pluginlink.server.connection.PluginNotFoundException;
import dev.pluginlink.transport.ConnectionPreface;
import dev.pluginlink.transport.Envelope;
import dev.pluginlink.transport.EnvelopeCodec;
import dev.pluginlink.transport.ErrorCodes;
import dev.pluginlink.transport.ProtocolViolationException;
import dev.pluginlink.transport.RemoteCallException;
import dev.pluginlink.transport.SocketEnvelopeStream;
import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.StandardSocketOptions;
import java.nio.ByteBuffer;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.security.MessageDigest;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Socket front of the plugin host, listening on TCP or a Unix domain socket. Each accepted
 * connection must start with a {@link ConnectionPreface} and is then served by the
 * {@link PluginStreamHandler} on its own pooled thread.
 *
 * <p>A connection has the registration timeout to present its preface and get admitted. After
 * that it stays open until either side closes it.
 */
public class PluginHostServer implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(PluginHostServer.class);

    /** How long a rejected connection is drained when no registration timeout applies. */
    private static final Duration REJECTION_DRAIN_TIMEOUT = Duration.ofSeconds(1);

    private final ListenAddress address;
    private final ConnectionRegistry registry;
    private final PluginStreamHandler handler;
    private final Duration registrationTimeout;
    private final int maxMessageSize;
    private final String authToken;
    private final EnvelopeCodec codec = new EnvelopeCodec();
    private final Set<SocketChannel> connections = ConcurrentHashMap.newKeySet();

    private ExecutorService connectionExecutor;
    private ScheduledExecutorService deadlineScheduler;
    private ServerSocketChannel serverChannel;
    private Thread acceptThread;
    private volatile boolean running;

    /**
     * @param registrationTimeout how long a new connection may take to register; zero disables
     * @param authToken bearer token plugins must present, or {@code null} to accept any plugin
     * @throws InvalidAddressException if {@code address} is not a {@code tcp://}, {@code unix://}
     *     or {@code host:port} address
     */
    public PluginHostServer(String address, ConnectionRegistry registry, PluginStreamHandler handler,
                            Duration registrationTimeout, int maxMessageSize, String authToken)
        throws InvalidAddressException {
        this.address = ListenAddress.parse(address);
        this.registry = Objects.requireNonNull(registry, "registry");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.registrationTimeout = registrationTimeout == null ? Duration.ZERO : registrationTimeout;
        if (maxMessageSize <= 0) {
            throw new IllegalArgumentException("maxMessageSize must be positive: " + maxMessageSize);
        }
        this.maxMessageSize = maxMessageSize;
        this.authToken = authToken == null || authToken.isBlank() ? null : authToken;
    }

    public synchronized void start() throws IOException {
        if (running) {
            return;
        }
        serverChannel = address.bind();
        connectionExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "plugin-host-connection");
            t.setDaemon(true);
            return t;
        });
        deadlineScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "plugin-host-deadline");
            t.setDaemon(true);
            return t;
        });
        running = true;
        acceptThread = new Thread(this::acceptLoop, "plugin-host-accept");
        acceptThread.start();
        LOGGER.info("Plugin host listening on {} (max connections {}, registration timeout {})",
            serverChannel.getLocalAddress(), registry.maxConnections(), registrationTimeout);
    }

    private void acceptLoop() {
        while (running) {
            try {
                SocketChannel channel = serverChannel.accept();
                if (address instanceof ListenAddress.Tcp) {
                    channel.setOption(StandardSocketOptions.TCP_NODELAY, true);
                }
                connections.add(channel);
                try {
                    connectionExecutor.submit(() -> serve(channel));
                } catch (RejectedExecutionException e) {
                    LOGGER.warn("Connection executor rejected {}", channel.getRemoteAddress());
                    connections.remove(channel);
                    channel.close();
                }
            } catch (IOException e) {
                if (running) {
                    LOGGER.error("Error accepting connection", e);
                }
                if (!serverChannel.isOpen()) {
                    return;
                }
            }
        }
    }

    private void serve(SocketChannel channel) {
        String connectionId = "unknown";
        RegistrationDeadline deadline = null;
        try (channel) {
            deadline = RegistrationDeadline.arm(deadlineScheduler, registrationTimeout, channel);
            SocketEnvelopeStream stream = new SocketEnvelopeStream(channel, codec, maxMessageSize);
            connectionId = stream.connectionId();
            LOGGER.info("Accepted connection {}", connectionId);
            ConnectionPreface preface = stream.readPreface();
            if (!authorized(preface)) {
                LOGGER.warn("Rejected connection {}: missing or invalid bearer token", connectionId);
                rejectUnauthenticated(stream, channel, deadline);
                return;
            }
            handler.handle(stream, deadline::disarm);
        } catch (RejectedExecutionException e) {
            LOGGER.debug("Connection {} arrived during shutdown", connectionId);
        } catch (PluginAdmissionException e) {
            LOGGER.warn("Rejected plugin {} on {}: {}", e.pluginName(), connectionId, e.getMessage());
        } catch (ProtocolViolationException e) {
            LOGGER.warn("Protocol violation on {}: {}", connectionId, e.getMessage());
        } catch (IOException e) {
            if (deadline != null && deadline.expired()) {
                LOGGER.info("Connection {} did not register within {}, closed", connectionId, registrationTimeout);
            } else if (running) {
                LOGGER.error("Connection error {}", connectionId, e);
            } else {
                LOGGER.debug("Connection {} ended during shutdown: {}", connectionId, e.getMessage());
            }
        } finally {
            if (deadline != null) {
                deadline.disarm();
            }
            connections.remove(channel);
            LOGGER.info("Connection {} closed", connectionId);
        }
    }

    private boolean authorized(ConnectionPreface preface) {
        if (authToken == null) {
            return true;
        }
        return preface.bearerToken()
            .map(token -> MessageDigest.isEqual(token.getBytes(StandardCharsets.UTF_8),
                authToken.getBytes(StandardCharsets.UTF_8)))
            .orElse(false);
    }

    /**
     * Tells the plugin why it is refused, then reads whatever it already sent until it hangs up,
     * so closing does not reset the connection before the plugin has read the rejection.
     */
    private void rejectUnauthenticated(SocketEnvelopeStream stream, SocketChannel channel,
                                       RegistrationDeadline deadline) throws IOException {
        stream.send(Envelope.error(null, ErrorCodes.UNAUTHENTICATED, "missing or invalid bearer token"));
        stream.closeSend();
        RegistrationDeadline drainDeadline = deadline.isArmed()
            ? deadline
            : RegistrationDeadline.arm(deadlineScheduler, REJECTION_DRAIN_TIMEOUT, channel);
        ByteBuffer discard = ByteBuffer.allocate(8192);
        try {
            int read;
            do {
                discard.clear();
                read = channel.read(discard);
            } while (read >= 0);
        } catch (IOException e) {
            LOGGER.debug("Stopped draining rejected connection {}: {}", stream.connectionId(), e.getMessage());
        } finally {
            drainDeadline.disarm();
        }
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        try {
            serverChannel.close();
        } catch (IOException e) {
            LOGGER.warn("Error closing server channel", e);
        }
        try {
            acceptThread.join(Duration.ofSeconds(1).toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        handler.closeAll();
        for (SocketChannel channel : new ArrayList<>(connections)) {
            try {
                channel.close();
            } catch (IOException e) {
                LOGGER.warn("Error closing connection", e);
            }
        }
        connectionExecutor.shutdown();
        deadlineScheduler.shutdownNow();
        try {
            if (!connectionExecutor.awaitTermination(1, TimeUnit.SECONDS)) {
                connectionExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (address instanceof ListenAddress.Unix unix) {
            try {
                Files.deleteIfExists(unix.path());
            } catch (IOException e) {
                LOGGER.warn("Could not remove socket file {}", unix.path(), e);
            }
        }
        LOGGER.info("Plugin host stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * TCP port the server is bound to; differs from the configured one when that was {@code 0}.
     * {@code -1} when listening on a Unix domain socket.
     */
    public int port() {
        if (!(address instanceof ListenAddress.Tcp tcp)) {
            return -1;
        }
        ServerSocketChannel channel = serverChannel;
        if (channel == null || !channel.isOpen()) {
            return tcp.port();
        }
        try {
            return ((InetSocketAddress) channel.getLocalAddress()).getPort();
        } catch (IOException e) {
            return tcp.port();
        }
    }

    public ListenAddress address() {
        return address;
    }

    public Set<String> listPlugins() {
        return registry.list();
    }

    public boolean isPluginConnected(String pluginName) {
        return registry.isAttached(pluginName);
    }

    public int connectionCount() {
        return registry.count();
    }

    /**
     * Calls {@code method} on the named plugin and waits for its response.
     *
     * @throws IllegalStateException if the server is not running
     * @throws PluginNotFoundException if no plugin with that name is attached
     */
    public byte[] call(String pluginName, String method, byte[] payload, Duration timeout)
        throws RemoteCallException, IOException, TimeoutException, InterruptedException {
        return channel(pluginName).call(method, payload, timeout);
    }

    public <T> T call(String pluginName, String method, Object request, Class<T> responseType, Duration timeout)
        throws RemoteCallException, IOException, TimeoutException, InterruptedException {
        return channel(pluginName).call(method, request, responseType, timeout);
    }

    private PluginChannel channel(String pluginName) throws PluginNotFoundException {
        if (!running) {
            throw new IllegalStateException("server not running");
        }
        return registry.channel(pluginName).orElseThrow(() -> new PluginNotFoundException(pluginName));
    }
}
