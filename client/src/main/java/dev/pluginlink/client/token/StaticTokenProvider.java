package dev.pluginlink.client.token;

import java.util.Objects;

/**
 * Always returns the same token. Meant for tests and local development.
 */
public final class StaticTokenProvider implements TokenProvider {

    private final String token;

    public StaticTokenProvider(String token) {
        this.token = Objects.requireNonNull(token, "token");
    }

    @Override
    public String getToken() {
        return token;
    }
}
