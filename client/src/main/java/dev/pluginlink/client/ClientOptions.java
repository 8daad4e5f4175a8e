package dev.pluginlink.client;

import dev.pluginlink.client.token.TokenProvider;
import dev.pluginlink.transport.LengthPrefixedCodec;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Settings for {@link PluginConnector#connect}.
 */
public final class ClientOptions {

    private final String host;
    private final int port;
    private final Path socketPath;
    private final String pluginName;
    private final String pluginVersion;
    private final TokenProvider tokenProvider;
    private final int maxConcurrentCalls;
    private final int maxMessageSize;
    private final Duration connectTimeout;

    private ClientOptions(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.socketPath = builder.socketPath;
        this.pluginName = builder.pluginName;
        this.pluginVersion = builder.pluginVersion;
        this.tokenProvider = builder.tokenProvider;
        this.maxConcurrentCalls = builder.maxConcurrentCalls;
        this.maxMessageSize = builder.maxMessageSize;
        this.connectTimeout = builder.connectTimeout;
    }

    public static Builder builder(String pluginName) {
        return new Builder(pluginName);
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    /**
     * @return the Unix domain socket to connect to, or {@code null} to connect over TCP
     */
    public Path socketPath() {
        return socketPath;
    }

    /**
     * Where the plugin connects, as a {@code tcp://} or {@code unix://} address.
     */
    public String endpoint() {
        return socketPath != null ? "unix://" + socketPath : "tcp://" + host + ":" + port;
    }

    public String pluginName() {
        return pluginName;
    }

    public String pluginVersion() {
        return pluginVersion;
    }

    /**
     * @return the token source, or {@code null} when the plugin connects without a token
     */
    public TokenProvider tokenProvider() {
        return tokenProvider;
    }

    public int maxConcurrentCalls() {
        return maxConcurrentCalls;
    }

    public int maxMessageSize() {
        return maxMessageSize;
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    public static final class Builder {

        private final String pluginName;
        private String host = "localhost";
        private int port = 7071;
        private Path socketPath;
        private String pluginVersion = "";
        private TokenProvider tokenProvider;
        private int maxConcurrentCalls = PluginDispatcher.DEFAULT_MAX_CONCURRENT_CALLS;
        private int maxMessageSize = LengthPrefixedCodec.DEFAULT_MAX_FRAME_SIZE;
        private Duration connectTimeout = Duration.ofSeconds(10);

        private Builder(String pluginName) {
            this.pluginName = Objects.requireNonNull(pluginName, "pluginName");
        }

        public Builder host(String host) {
            this.host = Objects.requireNonNull(host, "host");
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        /**
         * Connects over a Unix domain socket instead of TCP; host and port are then ignored.
         */
        public Builder socketPath(Path socketPath) {
            this.socketPath = socketPath;
            return this;
        }

        public Builder version(String pluginVersion) {
            this.pluginVersion = pluginVersion == null ? "" : pluginVersion;
            return this;
        }

        public Builder tokenProvider(TokenProvider tokenProvider) {
            this.tokenProvider = tokenProvider;
            return this;
        }

        public Builder maxConcurrentCalls(int maxConcurrentCalls) {
            this.maxConcurrentCalls = maxConcurrentCalls;
            return this;
        }

        public Builder maxMessageSize(int maxMessageSize) {
            this.maxMessageSize = maxMessageSize;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
            return this;
        }

        public ClientOptions build() {
            return new ClientOptions(this);
        }
    }
}
