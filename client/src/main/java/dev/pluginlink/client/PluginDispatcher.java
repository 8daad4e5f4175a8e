package dev.pluginlink.client;

import dev.pluginlink.transport.Envelope;
import dev.pluginlink.transport.EnvelopeStream;
import dev.pluginlink.transport.ErrorCodes;
import dev.pluginlink.transport.HalfCloseable;
import java.io.Closeable;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plugin end of a stream. Registers the plugin on construction, then {@link #serve()} answers
 * every call the host sends with the matching entry of the {@link MethodTable}.
 *
 * <p>Calls run on a fixed pool so a slow method does not hold up the calls behind it. Replies
 * may therefore leave in a different order than the calls arrived; the host matches them by
 * request id.
 */
public class PluginDispatcher implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(PluginDispatcher.class);

    public static final int DEFAULT_MAX_CONCURRENT_CALLS = 16;

    private final EnvelopeStream stream;
    private final String pluginName;
    private final MethodTable methods;
    private final ExecutorService callExecutor;
    private final ReentrantLock sendLock = new ReentrantLock();

    private volatile boolean shutdown;

    public PluginDispatcher(EnvelopeStream stream, String pluginName, String pluginVersion, MethodTable methods)
        throws IOException {
        this(stream, pluginName, pluginVersion, methods, DEFAULT_MAX_CONCURRENT_CALLS);
    }

    /**
     * Sends the registration for {@code pluginName}.
     *
     * @throws IOException if the registration could not be sent
     */
    public PluginDispatcher(EnvelopeStream stream, String pluginName, String pluginVersion, MethodTable methods,
                            int maxConcurrentCalls) throws IOException {
        this.stream = Objects.requireNonNull(stream, "stream");
        this.pluginName = Objects.requireNonNull(pluginName, "pluginName");
        this.methods = Objects.requireNonNull(methods, "methods");
        if (maxConcurrentCalls <= 0) {
            throw new IllegalArgumentException("maxConcurrentCalls must be positive: " + maxConcurrentCalls);
        }
        try {
            send(Envelope.register(pluginName, pluginVersion));
        } catch (IOException e) {
            throw new IOException("failed to send registration: " + e.getMessage(), e);
        }
        AtomicInteger threadCounter = new AtomicInteger();
        this.callExecutor = Executors.newFixedThreadPool(maxConcurrentCalls, r -> {
            Thread t = new Thread(r, "plugin-call-" + pluginName + "-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        LOGGER.info("Registered plugin {} version {} with {} methods", pluginName, pluginVersion, methods.size());
    }

    /**
     * Answers calls until the host ends the stream or {@link #shutdown()} is called, returning
     * normally in both cases.
     *
     * @throws IOException if the transport failed
     */
    public void serve() throws IOException {
        try {
            while (!shutdown) {
                Envelope envelope;
                try {
                    envelope = stream.receive();
                } catch (IOException e) {
                    if (shutdown) {
                        LOGGER.debug("Stream of plugin {} ended after shutdown: {}", pluginName, e.getMessage());
                        return;
                    }
                    throw e;
                }
                if (envelope == null) {
                    LOGGER.info("Host closed the stream of plugin {}", pluginName);
                    return;
                }
                if (envelope instanceof Envelope.RpcCall call) {
                    submit(call);
                } else if (envelope instanceof Envelope.RpcError error && error.requestId() == null) {
                    LOGGER.warn("Host rejected plugin {}: {} {}", pluginName, error.code(), error.message());
                } else {
                    LOGGER.warn("Ignoring unexpected {} from host", envelope.getClass().getSimpleName());
                }
            }
        } finally {
            callExecutor.shutdown();
        }
    }

    private void submit(Envelope.RpcCall call) {
        try {
            callExecutor.execute(() -> handleCall(call));
        } catch (RejectedExecutionException e) {
            LOGGER.warn("Dropping call {} {}: dispatcher is shutting down", call.requestId(), call.method());
        }
    }

    private void handleCall(Envelope.RpcCall call) {
        String requestId = call.requestId();
        Optional<MethodHandler> handler = methods.resolve(call.method());
        Envelope reply;
        if (handler.isEmpty()) {
            LOGGER.warn("Unknown method {} called on plugin {}", call.method(), pluginName);
            reply = Envelope.error(requestId, ErrorCodes.UNIMPLEMENTED, "unknown method " + call.method());
        } else {
            try {
                reply = Envelope.response(requestId, handler.get().handle(call.payload()));
            } catch (PayloadMarshalException e) {
                LOGGER.warn("Marshal failure in {} ({}): {}", call.method(), requestId, e.getMessage());
                reply = Envelope.error(requestId, ErrorCodes.MARSHAL_ERROR, e.getMessage());
            } catch (Exception e) {
                LOGGER.debug("Method {} ({}) failed", call.method(), requestId, e);
                reply = Envelope.error(requestId, ErrorCodes.RPC_ERROR, describe(e));
            } catch (Error e) {
                LOGGER.error("Method {} ({}) failed with {}", call.method(), requestId, e.getClass().getName(), e);
                reply = Envelope.error(requestId, ErrorCodes.RPC_ERROR, describe(e));
            }
        }
        try {
            send(reply);
        } catch (IOException e) {
            if (shutdown) {
                LOGGER.debug("Reply to {} not sent, stream is shut down", requestId);
            } else {
                LOGGER.error("Failed to send reply to {} ({})", call.method(), requestId, e);
            }
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
    }

    private void send(Envelope envelope) throws IOException {
        sendLock.lock();
        try {
            stream.send(envelope);
        } finally {
            sendLock.unlock();
        }
    }

    /**
     * Stops serving. The stream is half-closed when the transport supports it, so replies already
     * sent still reach the host; otherwise it is closed.
     */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        LOGGER.info("Shutting down plugin {}", pluginName);
        sendLock.lock();
        try {
            if (stream instanceof HalfCloseable halfCloseable) {
                halfCloseable.closeSend();
            } else {
                stream.close();
            }
        } catch (IOException e) {
            LOGGER.warn("Error closing stream of plugin {}", pluginName, e);
        } finally {
            sendLock.unlock();
        }
    }

    public boolean isShutdown() {
        return shutdown;
    }

    public String pluginName() {
        return pluginName;
    }

    @Override
    public void close() throws IOException {
        shutdown();
        callExecutor.shutdownNow();
        stream.close();
    }
}
