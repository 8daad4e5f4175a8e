package dev.pluginlink.server.config;

import dev.pluginlink.server.connection.ConnectionListener;
import dev.pluginlink.server.connection.ConnectionRegistry;
import dev.pluginlink.server.registry.PluginRegistry;
import dev.pluginlink.server.transport.InvalidAddressException;
import dev.pluginlink.server.transport.PluginHostServer;
import dev.pluginlink.server.transport.PluginStreamHandler;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(HostProperties.class)
public class PluginHostConfig {

    @Bean
    ConnectionRegistry connectionRegistry(HostProperties properties, ObjectProvider<ConnectionListener> listener) {
        return new ConnectionRegistry(properties.getMaxConnections(),
            listener.getIfUnique(() -> ConnectionListener.NOOP));
    }

    @Bean
    PluginRegistry pluginRegistry() {
        return new PluginRegistry();
    }

    @Bean
    PluginStreamHandler pluginStreamHandler(ConnectionRegistry connectionRegistry) {
        return new PluginStreamHandler(connectionRegistry);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    PluginHostServer pluginHostServer(HostProperties properties, ConnectionRegistry connectionRegistry,
                                      PluginStreamHandler pluginStreamHandler) throws InvalidAddressException {
        return new PluginHostServer(properties.getAddress(), connectionRegistry, pluginStreamHandler,
            properties.getRegistrationTimeout(), Math.toIntExact(properties.getMaxMessageSize().toBytes()),
            properties.getAuthToken());
    }
}
