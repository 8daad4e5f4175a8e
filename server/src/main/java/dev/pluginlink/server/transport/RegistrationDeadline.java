package dev.pluginlink.server.transport;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Closes a connection that has not been admitted within its time limit. Once {@link #disarm()}
 * runs the connection is left alone for good; there is no limit on how long an admitted plugin
 * may stay quiet.
 */
final class RegistrationDeadline {

    private static final Logger LOGGER = LoggerFactory.getLogger(RegistrationDeadline.class);

    private final AtomicBoolean settled = new AtomicBoolean();
    private final Closeable connection;
    private final ScheduledFuture<?> expiry;

    private volatile boolean expired;

    private RegistrationDeadline(ScheduledExecutorService scheduler, Duration timeout, Closeable connection) {
        this.connection = connection;
        this.expiry = timeout == null || timeout.isZero() || timeout.isNegative()
            ? null
            : scheduler.schedule(this::expire, timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * @param timeout zero or {@code null} for no limit
     */
    static RegistrationDeadline arm(ScheduledExecutorService scheduler, Duration timeout, Closeable connection) {
        return new RegistrationDeadline(scheduler, timeout, connection);
    }

    private void expire() {
        if (!settled.compareAndSet(false, true)) {
            return;
        }
        expired = true;
        try {
            connection.close();
        } catch (IOException e) {
            LOGGER.debug("Error closing connection after deadline: {}", e.getMessage());
        }
    }

    void disarm() {
        if (settled.compareAndSet(false, true) && expiry != null) {
            expiry.cancel(false);
        }
    }

    boolean isArmed() {
        return expiry != null;
    }

    /**
     * Whether the deadline passed and closed the connection.
     */
    boolean expired() {
        return expired;
    }
}
