package dev.pluginlink.server.config;

import dev.pluginlink.server.connection.ConnectionRegistry;
import dev.pluginlink.transport.LengthPrefixedCodec;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

@ConfigurationProperties(prefix = "plugin.host")
public class HostProperties {

    /**
     * Address plugins connect to: {@code tcp://host:port}, {@code host:port} or
     * {@code unix:///path/to/socket}.
     */
    private String address = "tcp://0.0.0.0:7071";

    /**
     * Upper bound on concurrently attached plugins.
     */
    private int maxConnections = ConnectionRegistry.DEFAULT_MAX_CONNECTIONS;

    /**
     * A new connection that has not presented its preface and registered within this time is
     * closed. Registered plugins are never timed out. Zero disables the check.
     */
    private Duration registrationTimeout = Duration.ofSeconds(30);

    /**
     * Largest envelope accepted or sent on a connection.
     */
    private DataSize maxMessageSize = DataSize.ofBytes(LengthPrefixedCodec.DEFAULT_MAX_FRAME_SIZE);

    /**
     * Bearer token plugins must present. When unset any plugin may connect.
     */
    private String authToken;

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public void setMaxConnections(int maxConnections) {
        this.maxConnections = maxConnections;
    }

    public Duration getRegistrationTimeout() {
        return registrationTimeout;
    }

    public void setRegistrationTimeout(Duration registrationTimeout) {
        this.registrationTimeout = registrationTimeout;
    }

    public DataSize getMaxMessageSize() {
        return maxMessageSize;
    }

    public void setMaxMessageSize(DataSize maxMessageSize) {
        this.maxMessageSize = maxMessageSize;
    }

    public String getAuthToken() {
        return authToken;
    }

    public void setAuthToken(String authToken) {
        this.authToken = authToken;
    }
}
