package dev.pluginlink.client.token;

import java.io.IOException;

/**
 * Source of the bearer token a plugin presents to the host.
 */
@FunctionalInterface
public interface TokenProvider {

    String getToken() throws IOException;
}
