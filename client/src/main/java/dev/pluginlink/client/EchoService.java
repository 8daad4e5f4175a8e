package dev.pluginlink.client;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Methods of the example plugin started by {@link Main}.
 */
public class EchoService {

    private final String pluginName;
    private final String pluginVersion;
    private final Instant startedAt = Instant.now();

    public EchoService(String pluginName, String pluginVersion) {
        this.pluginName = pluginName;
        this.pluginVersion = pluginVersion;
    }

    @RpcMethod("Echo")
    public byte[] echo(byte[] payload) {
        return payload;
    }

    @RpcMethod("Info")
    public Map<String, String> info() {
        return Map.of(
            "name", pluginName,
            "version", pluginVersion,
            "uptime", Duration.between(startedAt, Instant.now()).toString());
    }

    @RpcMethod("Sleep")
    public long sleep(long millis) throws InterruptedException {
        Thread.sleep(millis);
        return millis;
    }
}
