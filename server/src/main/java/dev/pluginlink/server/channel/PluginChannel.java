package dev.pluginlink.server.channel;

import dev.pluginlink.transport.Envelope;
import dev.pluginlink.transport.EnvelopeStream;
import dev.pluginlink.transport.PayloadCodec;
import dev.pluginlink.transport.RemoteCallException;
import dev.pluginlink.transport.StreamClosedException;
import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Host end of a registered plugin stream. Turns the duplex envelope stream into call/response
 * semantics: each call is tagged with a request id, and {@link #listen()} hands every response to
 * the call waiting for that id.
 *
 * <p>Request ids are a random per-channel prefix followed by a counter, so ids never repeat on a
 * channel. When the stream ends every call still waiting fails with {@link StreamClosedException}.
 */
public class PluginChannel implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(PluginChannel.class);

    private final EnvelopeStream stream;
    private final String pluginName;
    private final PayloadCodec payloadCodec;
    private final Runnable onMessage;
    private final String idPrefix = UUID.randomUUID().toString().substring(0, 8);
    private final AtomicLong requestCounter = new AtomicLong();
    private final Map<String, CompletableFuture<byte[]>> pending = new ConcurrentHashMap<>();
    private final Object sendLock = new Object();

    private volatile boolean closed;

    public PluginChannel(EnvelopeStream stream, String pluginName) {
        this(stream, pluginName, new PayloadCodec(), () -> {
        });
    }

    /**
     * @param onMessage run for every envelope received, before it is dispatched
     */
    public PluginChannel(EnvelopeStream stream, String pluginName, PayloadCodec payloadCodec, Runnable onMessage) {
        this.stream = Objects.requireNonNull(stream, "stream");
        this.pluginName = Objects.requireNonNull(pluginName, "pluginName");
        this.payloadCodec = Objects.requireNonNull(payloadCodec, "payloadCodec");
        this.onMessage = Objects.requireNonNull(onMessage, "onMessage");
    }

    public String pluginName() {
        return pluginName;
    }

    /**
     * Sends a call and returns its eventual response payload. Cancelling the returned future, or
     * completing it in any other way, forgets the call; a late response is then dropped.
     */
    public CompletableFuture<byte[]> callAsync(String method, byte[] payload) {
        Objects.requireNonNull(method, "method");
        if (closed) {
            return CompletableFuture.failedFuture(streamClosed(null));
        }
        String requestId = nextRequestId();
        CompletableFuture<byte[]> future = new CompletableFuture<>();
        pending.put(requestId, future);
        future.whenComplete((result, error) -> pending.remove(requestId, future));
        if (closed) {
            future.completeExceptionally(streamClosed(null));
            return future;
        }
        try {
            synchronized (sendLock) {
                stream.send(Envelope.call(requestId, method, payload));
            }
        } catch (IOException e) {
            LOGGER.warn("Failed to send call {} to plugin {}", method, pluginName, e);
            future.completeExceptionally(e);
        }
        return future;
    }

    /**
     * Sends a call and waits for its response.
     *
     * @throws RemoteCallException if the plugin answered with an error
     * @throws StreamClosedException if the stream ended before the response arrived
     * @throws TimeoutException if no response arrived within {@code timeout}; the call is forgotten
     */
    public byte[] call(String method, byte[] payload, Duration timeout)
        throws RemoteCallException, IOException, TimeoutException, InterruptedException {
        CompletableFuture<byte[]> future = callAsync(method, payload);
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(false);
            throw new TimeoutException("Call " + method + " to plugin " + pluginName + " timed out after " + timeout);
        } catch (InterruptedException e) {
            future.cancel(false);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RemoteCallException remote) {
                throw remote;
            }
            if (cause instanceof IOException io) {
                throw io;
            }
            throw new IOException("Call " + method + " to plugin " + pluginName + " failed", cause);
        }
    }

    /**
     * Typed variant of {@link #call(String, byte[], Duration)}: the request is serialized with the
     * payload codec and the response deserialized into {@code responseType}.
     */
    public <T> T call(String method, Object request, Class<T> responseType, Duration timeout)
        throws RemoteCallException, IOException, TimeoutException, InterruptedException {
        byte[] payload;
        try {
            payload = payloadCodec.encode(request);
        } catch (IOException e) {
            throw new IOException("Failed to marshal request for " + method, e);
        }
        byte[] response = call(method, payload, timeout);
        try {
            return payloadCodec.decode(response, responseType);
        } catch (IOException e) {
            throw new IOException("Failed to unmarshal response of " + method, e);
        }
    }

    /**
     * Receives envelopes until the plugin finishes its stream or the channel is closed. Returns
     * normally in both cases and throws on transport failure. Either way, calls still waiting
     * are failed with {@link StreamClosedException}.
     */
    public void listen() throws IOException {
        IOException failure = null;
        try {
            while (!closed) {
                Envelope envelope = stream.receive();
                if (envelope == null) {
                    LOGGER.info("Plugin {} closed its stream", pluginName);
                    return;
                }
                onMessage.run();
                dispatch(envelope);
            }
        } catch (IOException e) {
            if (closed) {
                LOGGER.debug("Stream of plugin {} closed locally: {}", pluginName, e.getMessage());
                return;
            }
            failure = e;
            throw e;
        } finally {
            failPending(failure);
        }
    }

    private void dispatch(Envelope envelope) {
        if (envelope instanceof Envelope.RpcResponse response) {
            CompletableFuture<byte[]> future = pending.remove(response.requestId());
            if (future == null) {
                LOGGER.debug("No pending call for response {} from plugin {}", response.requestId(), pluginName);
                return;
            }
            future.complete(response.payload());
        } else if (envelope instanceof Envelope.RpcError error) {
            CompletableFuture<byte[]> future = error.requestId() == null ? null : pending.remove(error.requestId());
            if (future == null) {
                LOGGER.warn("Plugin {} reported error {}: {}", pluginName, error.code(), error.message());
                return;
            }
            future.completeExceptionally(RemoteCallException.from(error));
        } else {
            LOGGER.warn("Ignoring unexpected {} from plugin {}", envelope.getClass().getSimpleName(), pluginName);
        }
    }

    private void failPending(Throwable cause) {
        closed = true;
        for (Map.Entry<String, CompletableFuture<byte[]>> entry : pending.entrySet()) {
            if (pending.remove(entry.getKey(), entry.getValue())) {
                entry.getValue().completeExceptionally(streamClosed(cause));
            }
        }
    }

    private StreamClosedException streamClosed(Throwable cause) {
        return new StreamClosedException("Stream to plugin " + pluginName + " closed", cause);
    }

    private String nextRequestId() {
        return idPrefix + "-" + requestCounter.incrementAndGet();
    }

    /**
     * Number of calls waiting for a response.
     */
    public int pendingCalls() {
        return pending.size();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() throws IOException {
        closed = true;
        try {
            stream.close();
        } finally {
            failPending(null);
        }
    }
}
