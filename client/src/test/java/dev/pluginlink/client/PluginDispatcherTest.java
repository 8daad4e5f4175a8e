package dev.pluginlink.client;

import dev.pluginlink.transport.Envelope;
import dev.pluginlink.transport.ErrorCodes;
import dev.pluginlink.transport.PipeEnvelopeStream;
import dev.pluginlink.transport.StreamClosedException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PluginDispatcherTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final CountDownLatch release = new CountDownLatch(1);

    private PipeEnvelopeStream.Pair pipe;
    private PluginDispatcher dispatcher;
    private Future<Void> serving;

    @BeforeEach
    void setUp() throws Exception {
        pipe = PipeEnvelopeStream.pair("echo");
        MethodTable methods = MethodTable.builder()
            .raw("Echo", payload -> payload)
            .raw("Fail", payload -> {
                throw new IllegalStateException("handler exploded");
            })
            .raw("Assert", payload -> {
                throw new AssertionError("bad state");
            })
            .raw("Block", payload -> {
                release.await();
                return payload;
            })
            .method("Greet", Map.class, request -> Map.of("greeting", "hello " + request.get("name")))
            .build();
        dispatcher = new PluginDispatcher(pipe.plugin(), "echo", "v1", methods, 4);
        assertEquals(Envelope.register("echo", "v1"), pipe.host().receive());
        serving = executor.submit(() -> {
            dispatcher.serve();
            return null;
        });
    }

    @AfterEach
    void tearDown() throws IOException {
        release.countDown();
        dispatcher.close();
        executor.shutdownNow();
    }

    @Test
    void callIsAnsweredWithTheHandlersPayload() throws Exception {
        pipe.host().send(Envelope.call("r-1", "/echo.EchoService/Echo", "hello".getBytes(StandardCharsets.UTF_8)));

        Envelope.RpcResponse response = (Envelope.RpcResponse) pipe.host().receive();

        assertEquals("r-1", response.requestId());
        assertEquals("hello", new String(response.payload(), StandardCharsets.UTF_8));
    }

    @Test
    void unknownMethodIsUnimplemented() throws Exception {
        pipe.host().send(Envelope.call("r-1", "/echo.EchoService/Missing", new byte[0]));

        assertEquals(Envelope.error("r-1", ErrorCodes.UNIMPLEMENTED, "unknown method /echo.EchoService/Missing"),
            pipe.host().receive());
    }

    @Test
    void handlerFailureIsReportedAsRpcError() throws Exception {
        pipe.host().send(Envelope.call("r-1", "Fail", new byte[0]));

        assertEquals(Envelope.error("r-1", ErrorCodes.RPC_ERROR, "handler exploded"), pipe.host().receive());
    }

    @Test
    void handlerErrorIsReportedAsRpcErrorAndServingContinues() throws Exception {
        pipe.host().send(Envelope.call("r-1", "Assert", new byte[0]));

        assertEquals(Envelope.error("r-1", ErrorCodes.RPC_ERROR, "bad state"), pipe.host().receive());

        pipe.host().send(Envelope.call("r-2", "Echo", new byte[] {1}));
        assertEquals(Envelope.response("r-2", new byte[] {1}), pipe.host().receive());
    }

    @Test
    void undecodableRequestIsReportedAsMarshalError() throws Exception {
        pipe.host().send(Envelope.call("r-1", "Greet", "{broken".getBytes(StandardCharsets.UTF_8)));

        Envelope.RpcError error = (Envelope.RpcError) pipe.host().receive();
        assertEquals("r-1", error.requestId());
        assertEquals(ErrorCodes.MARSHAL_ERROR, error.code());
    }

    @Test
    void slowCallDoesNotHoldUpLaterCalls() throws Exception {
        pipe.host().send(Envelope.call("slow", "Block", new byte[] {1}));
        pipe.host().send(Envelope.call("fast", "Echo", new byte[] {2}));

        Envelope.RpcResponse first = (Envelope.RpcResponse) pipe.host().receive();
        assertEquals("fast", first.requestId());

        release.countDown();
        Envelope.RpcResponse second = (Envelope.RpcResponse) pipe.host().receive();
        assertEquals("slow", second.requestId());
    }

    @Test
    void concurrentCallsEachGetTheirOwnReply() throws Exception {
        int calls = 50;
        for (int i = 0; i < calls; i++) {
            pipe.host().send(Envelope.call("r-" + i, "Echo", new byte[] {(byte) i}));
        }

        Map<String, byte[]> replies = new HashMap<>();
        for (int i = 0; i < calls; i++) {
            Envelope.RpcResponse response = (Envelope.RpcResponse) pipe.host().receive();
            replies.put(response.requestId(), response.payload());
        }
        assertEquals(calls, replies.size());
        for (int i = 0; i < calls; i++) {
            assertArrayEquals(new byte[] {(byte) i}, replies.get("r-" + i));
        }
    }

    @Test
    void hostEndingTheStreamEndsServeNormally() throws Exception {
        pipe.host().closeSend();

        assertNull(serving.get(5, TimeUnit.SECONDS));
    }

    @Test
    void rejectionFromHostIsLoggedAndServeContinues() throws Exception {
        pipe.host().send(Envelope.error(null, ErrorCodes.RESOURCE_EXHAUSTED, "max plugin connections reached (1)"));
        pipe.host().send(Envelope.call("r-1", "Echo", new byte[] {5}));

        assertEquals("r-1", ((Envelope.RpcResponse) pipe.host().receive()).requestId());
    }

    @Test
    void shutdownHalfClosesSoTheHostSeesEndOfStream() throws Exception {
        dispatcher.shutdown();

        assertNull(pipe.host().receive());
        assertThrows(StreamClosedException.class, () -> pipe.plugin().send(Envelope.response("r-1", null)));
        pipe.host().closeSend();
        assertNull(serving.get(5, TimeUnit.SECONDS));
        assertTrue(dispatcher.isShutdown());
    }

    @Test
    void transportFailurePropagatesFromServe() {
        pipe.plugin().fail(new IOException("connection reset"));

        ExecutionException e = assertThrows(ExecutionException.class, () -> serving.get(5, TimeUnit.SECONDS));
        assertEquals("connection reset", e.getCause().getMessage());
    }

    @Test
    void failedRegistrationFailsConstruction() {
        PipeEnvelopeStream broken = PipeEnvelopeStream.pair("broken").plugin();
        broken.closeSend();

        IOException e = assertThrows(IOException.class,
            () -> new PluginDispatcher(broken, "broken", "v1", MethodTable.builder().build()));
        assertTrue(e.getMessage().startsWith("failed to send registration"));
    }
}
