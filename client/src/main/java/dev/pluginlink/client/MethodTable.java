package dev.pluginlink.client;

import dev.pluginlink.transport.PayloadCodec;
import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping from method name to the handler implementing it. Incoming calls may carry a
 * qualified name such as {@code /echo.EchoService/Echo} or {@code echo.EchoService.Echo}; only the
 * final segment is matched against the table.
 */
public final class MethodTable {

    private final Map<String, MethodHandler> handlers;

    private MethodTable(Map<String, MethodHandler> handlers) {
        this.handlers = Map.copyOf(handlers);
    }

    public static Builder builder() {
        return new Builder(new PayloadCodec());
    }

    public static Builder builder(PayloadCodec codec) {
        return new Builder(codec);
    }

    /**
     * Builds a table from the public methods of {@code service} annotated with {@link RpcMethod}.
     * Each method takes at most one parameter. A {@code byte[]} parameter and result are passed
     * through untouched; anything else is JSON.
     */
    public static MethodTable fromService(Object service) {
        return fromService(service, new PayloadCodec());
    }

    public static MethodTable fromService(Object service, PayloadCodec codec) {
        Objects.requireNonNull(service, "service");
        Builder builder = builder(codec);
        for (Method method : service.getClass().getMethods()) {
            RpcMethod annotation = method.getAnnotation(RpcMethod.class);
            if (annotation == null || Modifier.isStatic(method.getModifiers())) {
                continue;
            }
            if (method.getParameterCount() > 1) {
                throw new IllegalArgumentException("RPC method " + method.getName() + " takes more than one parameter");
            }
            method.trySetAccessible();
            String name = annotation.value().isEmpty() ? method.getName() : annotation.value();
            Class<?> requestType = method.getParameterCount() == 0 ? Void.class : method.getParameterTypes()[0];
            addMethod(builder, name, requestType, service, method);
        }
        return builder.build();
    }

    private static <Q> void addMethod(Builder builder, String name, Class<Q> requestType, Object service,
                                      Method method) {
        builder.method(name, requestType, request -> invoke(service, method, request));
    }

    private static Object invoke(Object service, Method method, Object request) throws Exception {
        try {
            return method.getParameterCount() == 0 ? method.invoke(service) : method.invoke(service, request);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    /**
     * Final segment of a qualified method name, after the last {@code /} or {@code .}.
     */
    public static String simpleName(String fullMethod) {
        int separator = Math.max(fullMethod.lastIndexOf('/'), fullMethod.lastIndexOf('.'));
        return fullMethod.substring(separator + 1);
    }

    public Optional<MethodHandler> resolve(String fullMethod) {
        if (fullMethod == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(simpleName(fullMethod)));
    }

    public Set<String> methodNames() {
        return handlers.keySet();
    }

    public int size() {
        return handlers.size();
    }

    /**
     * Handler working on decoded values instead of payload bytes.
     *
     * @param <Q> request type
     * @param <R> response type
     */
    @FunctionalInterface
    public interface TypedHandler<Q, R> {

        R handle(Q request) throws Exception;
    }

    public static final class Builder {

        private final PayloadCodec codec;
        private final Map<String, MethodHandler> handlers = new LinkedHashMap<>();

        private Builder(PayloadCodec codec) {
            this.codec = Objects.requireNonNull(codec, "codec");
        }

        public Builder raw(String name, MethodHandler handler) {
            Objects.requireNonNull(handler, "handler");
            checkName(name);
            if (handlers.putIfAbsent(name, handler) != null) {
                throw new IllegalArgumentException("Duplicate RPC method " + name);
            }
            return this;
        }

        public <Q, R> Builder method(String name, Class<Q> requestType, TypedHandler<? super Q, R> handler) {
            Objects.requireNonNull(requestType, "requestType");
            Objects.requireNonNull(handler, "handler");
            return raw(name, payload -> {
                Q request;
                try {
                    request = codec.decode(payload, requestType);
                } catch (IOException e) {
                    throw new PayloadMarshalException("failed to unmarshal request: " + e.getMessage(), e);
                }
                R result = handler.handle(request);
                try {
                    return codec.encode(result);
                } catch (IOException e) {
                    throw new PayloadMarshalException("failed to marshal response: " + e.getMessage(), e);
                }
            });
        }

        private static void checkName(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("RPC method name cannot be empty");
            }
            if (name.indexOf('/') >= 0 || name.indexOf('.') >= 0) {
                throw new IllegalArgumentException("RPC method name must be a simple name: " + name);
            }
        }

        public MethodTable build() {
            return new MethodTable(handlers);
        }
    }
}
