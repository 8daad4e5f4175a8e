package dev.pluginlink.server.transport;

import dev.pluginlink.client.MethodTable;
import dev.pluginlink.client.PluginDispatcher;
import dev.pluginlink.server.connection.ConnectionListener;
import dev.pluginlink.server.connection.ConnectionRegistry;
import dev.pluginlink.server.connection.MaxConnectionsReachedException;
import dev.pluginlink.server.connection.PluginConnectException;
import dev.pluginlink.transport.Envelope;
import dev.pluginlink.transport.ErrorCodes;
import dev.pluginlink.transport.PipeEnvelopeStream;
import dev.pluginlink.transport.ProtocolViolationException;
import dev.pluginlink.transport.RemoteCallException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PluginStreamHandlerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void firstMessageOtherThanRegisterIsRejected() throws Exception {
        ConnectionRegistry registry = new ConnectionRegistry();
        PluginStreamHandler handler = new PluginStreamHandler(registry);
        PipeEnvelopeStream.Pair pipe = PipeEnvelopeStream.pair("bad");
        pipe.plugin().send(Envelope.call("r-1", "Echo", null));

        assertThrows(ProtocolViolationException.class, () -> handler.handle(pipe.host()));

        assertEquals(Envelope.error(null, ErrorCodes.INVALID_ARGUMENT, "first message must be Register"),
            pipe.plugin().receive());
        assertNull(pipe.plugin().receive());
        assertEquals(0, registry.count());
    }

    @Test
    void blankPluginNameIsRejected() throws Exception {
        ConnectionRegistry registry = new ConnectionRegistry();
        PluginStreamHandler handler = new PluginStreamHandler(registry);
        PipeEnvelopeStream.Pair pipe = PipeEnvelopeStream.pair("blank");
        pipe.plugin().send(Envelope.register(" ", "v1"));

        assertThrows(ProtocolViolationException.class, () -> handler.handle(pipe.host()));

        assertEquals(Envelope.error(null, ErrorCodes.INVALID_ARGUMENT, "plugin name cannot be empty"),
            pipe.plugin().receive());
        assertEquals(0, registry.count());
    }

    @Test
    void streamEndingBeforeRegistrationIsAProtocolViolation() {
        PluginStreamHandler handler = new PluginStreamHandler(new ConnectionRegistry());
        PipeEnvelopeStream.Pair pipe = PipeEnvelopeStream.pair("silent");
        pipe.plugin().closeSend();

        assertThrows(ProtocolViolationException.class, () -> handler.handle(pipe.host()));
    }

    @Test
    void registeredPluginAnswersCallsUntilItShutsDown() throws Exception {
        ConnectionRegistry registry = new ConnectionRegistry();
        PluginStreamHandler handler = new PluginStreamHandler(registry);
        PipeEnvelopeStream.Pair pipe = PipeEnvelopeStream.pair("echo");
        PluginDispatcher dispatcher = new PluginDispatcher(pipe.plugin(), "echo", "v1",
            MethodTable.builder().raw("Echo", payload -> payload).build());
        Future<?> plugin = executor.submit(() -> {
            dispatcher.serve();
            return null;
        });
        Future<?> host = executor.submit(() -> {
            handler.handle(pipe.host());
            return null;
        });
        awaitCondition(() -> registry.isAttached("echo"));

        byte[] response = registry.channel("echo").orElseThrow()
            .call("/echo.EchoService/Echo", "hello".getBytes(StandardCharsets.UTF_8), TIMEOUT);
        assertEquals("hello", new String(response, StandardCharsets.UTF_8));
        assertEquals("v1", registry.info("echo").orElseThrow().version());

        RemoteCallException unknown = assertThrows(RemoteCallException.class,
            () -> registry.channel("echo").orElseThrow().call("Missing", new byte[0], TIMEOUT));
        assertEquals(ErrorCodes.UNIMPLEMENTED, unknown.code());

        dispatcher.shutdown();
        host.get(5, TimeUnit.SECONDS);
        plugin.get(5, TimeUnit.SECONDS);
        assertFalse(registry.isAttached("echo"));
        assertEquals(0, handler.activeStreams());
    }

    @Test
    void pluginBeyondCapacityIsToldWhy() throws Exception {
        ConnectionRegistry registry = new ConnectionRegistry(1);
        PluginStreamHandler handler = new PluginStreamHandler(registry);
        PipeEnvelopeStream.Pair first = PipeEnvelopeStream.pair("first");
        first.plugin().send(Envelope.register("first", "v1"));
        Future<?> firstHost = executor.submit(() -> {
            handler.handle(first.host());
            return null;
        });
        awaitCondition(() -> registry.isAttached("first"));

        PipeEnvelopeStream.Pair second = PipeEnvelopeStream.pair("second");
        second.plugin().send(Envelope.register("second", "v1"));
        assertThrows(MaxConnectionsReachedException.class, () -> handler.handle(second.host()));

        Envelope.RpcError rejection = (Envelope.RpcError) second.plugin().receive();
        assertEquals(ErrorCodes.RESOURCE_EXHAUSTED, rejection.code());
        assertNull(rejection.requestId());
        assertTrue(registry.isAttached("first"));
        assertFalse(registry.isAttached("second"));

        first.plugin().closeSend();
        firstHost.get(5, TimeUnit.SECONDS);
        assertEquals(0, registry.count());
    }

    @Test
    void failingConnectCallbackRejectsWithInternalError() throws Exception {
        ConnectionListener refuseAll = new ConnectionListener() {
            @Override
            public void onConnect(String pluginName) {
                throw new IllegalStateException("not allowed");
            }
        };
        ConnectionRegistry registry = new ConnectionRegistry(5, refuseAll);
        PluginStreamHandler handler = new PluginStreamHandler(registry);
        PipeEnvelopeStream.Pair pipe = PipeEnvelopeStream.pair("refused");
        pipe.plugin().send(Envelope.register("refused", "v1"));

        assertThrows(PluginConnectException.class, () -> handler.handle(pipe.host()));

        Envelope.RpcError rejection = (Envelope.RpcError) pipe.plugin().receive();
        assertEquals(ErrorCodes.INTERNAL, rejection.code());
        assertFalse(registry.isAttached("refused"));
    }

    @Test
    void closeAllEndsEveryServedStream() throws Exception {
        ConnectionRegistry registry = new ConnectionRegistry();
        PluginStreamHandler handler = new PluginStreamHandler(registry);
        PipeEnvelopeStream.Pair pipe = PipeEnvelopeStream.pair("echo");
        pipe.plugin().send(Envelope.register("echo", "v1"));
        Future<?> host = executor.submit(() -> {
            handler.handle(pipe.host());
            return null;
        });
        awaitCondition(() -> registry.isAttached("echo"));

        handler.closeAll();

        host.get(5, TimeUnit.SECONDS);
        assertFalse(registry.isAttached("echo"));
        assertNull(pipe.plugin().receive());
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within 5 seconds");
            }
            Thread.sleep(10);
        }
    }
}
