package nl.pim16aap2.valheimkeeper.server.watchdog;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Counts the consecutive restarts of a server and computes the backoff before the next one.
 * <p>
 * Not thread-safe; the owning {@link Watchdog} guards it.
 */
final class RestartPolicy
{
    /**
     * Upper bound of the delay between two restarts.
     */
    static final Duration MAX_DELAY = Duration.ofMinutes(10);

    private WatchdogConfig config;
    private int attemptCount;
    private @Nullable Instant lastRestartTime;

    RestartPolicy(WatchdogConfig config)
    {
        this.config = Objects.requireNonNull(config, "config may not be null.");
    }

    boolean canRestart()
    {
        return attemptCount < config.maxRestarts();
    }

    /**
     * @return The delay before the next restart: {@code restartDelay * backoffMultiplier^attempts}, capped at
     *     {@link #MAX_DELAY}.
     */
    Duration nextDelay()
    {
        final double millis = config.restartDelay().toMillis() * Math.pow(config.backoffMultiplier(), attemptCount);
        if (Double.isNaN(millis) || millis >= MAX_DELAY.toMillis())
            return MAX_DELAY;
        return Duration.ofMillis((long) millis);
    }

    /**
     * Counts a restart.
     *
     * @param now
     *     The time of the restart.
     * @return The number of the restart, starting at 1.
     */
    int recordRestart(Instant now)
    {
        lastRestartTime = now;
        return ++attemptCount;
    }

    void reset()
    {
        attemptCount = 0;
        lastRestartTime = null;
    }

    void updateConfig(WatchdogConfig config)
    {
        this.config = Objects.requireNonNull(config, "config may not be null.");
    }

    int attemptCount()
    {
        return attemptCount;
    }

    @Nullable Instant lastRestartTime()
    {
        return lastRestartTime;
    }
}
