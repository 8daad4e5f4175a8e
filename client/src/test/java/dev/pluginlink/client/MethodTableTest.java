package dev.pluginlink.client;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MethodTableTest {

    public static class Calculator {

        @RpcMethod("Add")
        public int add(int[] operands) {
            int sum = 0;
            for (int operand : operands) {
                sum += operand;
            }
            return sum;
        }

        @RpcMethod
        public String version() {
            return "1.2.3";
        }

        public String notExposed() {
            return "hidden";
        }
    }

    public static class TooManyParameters {

        @RpcMethod
        public int add(int a, int b) {
            return a + b;
        }
    }

    @Test
    void resolvesOnTheFinalSegmentOfQualifiedNames() {
        MethodTable table = MethodTable.builder().raw("Echo", payload -> payload).build();

        assertTrue(table.resolve("Echo").isPresent());
        assertTrue(table.resolve("/echo.EchoService/Echo").isPresent());
        assertTrue(table.resolve("echo.EchoService.Echo").isPresent());
        assertTrue(table.resolve("/echo.EchoService/echo").isEmpty());
        assertTrue(table.resolve("Missing").isEmpty());
        assertTrue(table.resolve(null).isEmpty());
    }

    @Test
    void simpleNameTakesWhicheverSeparatorComesLast() {
        assertEquals("Echo", MethodTable.simpleName("/pkg.Service/Echo"));
        assertEquals("Echo", MethodTable.simpleName("pkg.Service.Echo"));
        assertEquals("Echo", MethodTable.simpleName("Echo"));
        assertEquals("", MethodTable.simpleName("pkg.Service/"));
    }

    @Test
    void typedMethodsExchangeJson() throws Exception {
        MethodTable table = MethodTable.builder()
            .method("Greet", Map.class, request -> Map.of("greeting", "hello " + request.get("name")))
            .build();

        byte[] response = table.resolve("Greet").orElseThrow()
            .handle("{\"name\":\"plugin\"}".getBytes(StandardCharsets.UTF_8));

        assertEquals("{\"greeting\":\"hello plugin\"}", new String(response, StandardCharsets.UTF_8));
    }

    @Test
    void undecodableRequestIsAMarshalFailure() {
        MethodTable table = MethodTable.builder()
            .method("Greet", Map.class, request -> request)
            .build();
        MethodHandler handler = table.resolve("Greet").orElseThrow();

        PayloadMarshalException e = assertThrows(PayloadMarshalException.class,
            () -> handler.handle("not json".getBytes(StandardCharsets.UTF_8)));
        assertTrue(e.getMessage().startsWith("failed to unmarshal request"));
    }

    @Test
    void unencodableResultIsAMarshalFailure() {
        MethodTable table = MethodTable.builder()
            .method("Leak", Void.class, request -> new Object())
            .build();

        PayloadMarshalException e = assertThrows(PayloadMarshalException.class,
            () -> table.resolve("Leak").orElseThrow().handle(new byte[0]));
        assertTrue(e.getMessage().startsWith("failed to marshal response"));
    }

    @Test
    void serviceMethodsAreDiscoveredByAnnotation() throws Exception {
        MethodTable table = MethodTable.fromService(new Calculator());

        assertEquals(Set.of("Add", "version"), table.methodNames());
        byte[] sum = table.resolve("calc.Calculator.Add").orElseThrow()
            .handle("[1,2,3]".getBytes(StandardCharsets.UTF_8));
        assertEquals("6", new String(sum, StandardCharsets.UTF_8));
        byte[] version = table.resolve("version").orElseThrow().handle(new byte[0]);
        assertEquals("\"1.2.3\"", new String(version, StandardCharsets.UTF_8));
    }

    @Test
    void serviceMethodFailuresSurfaceUnwrapped() {
        MethodTable table = MethodTable.fromService(new Object() {
            @RpcMethod("Fail")
            public byte[] fail(byte[] payload) {
                throw new IllegalStateException("boom");
            }
        });

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> table.resolve("Fail").orElseThrow().handle(new byte[0]));
        assertEquals("boom", e.getMessage());
    }

    @Test
    void rejectsInvalidTables() {
        assertThrows(IllegalArgumentException.class, () -> MethodTable.fromService(new TooManyParameters()));
        assertThrows(IllegalArgumentException.class,
            () -> MethodTable.builder().raw("Echo", p -> p).raw("Echo", p -> p));
        assertThrows(IllegalArgumentException.class, () -> MethodTable.builder().raw("pkg.Echo", p -> p));
        assertThrows(IllegalArgumentException.class, () -> MethodTable.builder().raw(" ", p -> p));
    }
}
