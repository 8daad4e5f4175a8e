package dev.pluginlink.client.token;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads the token from a file on every call, so a rotated token is picked up. By default reads
 * the Kubernetes service account token mounted into the pod.
 */
public final class FileTokenProvider implements TokenProvider {

    public static final Path SERVICE_ACCOUNT_TOKEN_PATH = Path.of("/var/run/secrets/kubernetes.io/serviceaccount/token");

    private final Path tokenPath;

    public FileTokenProvider() {
        this(SERVICE_ACCOUNT_TOKEN_PATH);
    }

    public FileTokenProvider(Path tokenPath) {
        this.tokenPath = Objects.requireNonNull(tokenPath, "tokenPath");
    }

    @Override
    public String getToken() throws IOException {
        try {
            return Files.readString(tokenPath, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IOException("failed to read token from " + tokenPath + ": " + e.getMessage(), e);
        }
    }

    public Path tokenPath() {
        return tokenPath;
    }
}
