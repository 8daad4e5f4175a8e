package dev.pluginlink.server.connection;

import java.time.Duration;
import java.time.Instant;

/**
 * Snapshot of an attached plugin's connection.
 */
public record PluginConnectionInfo(
    String name,
    String version,
    Instant connectedAt,
    Instant lastMessageAt,
    Duration uptime
) {
}
