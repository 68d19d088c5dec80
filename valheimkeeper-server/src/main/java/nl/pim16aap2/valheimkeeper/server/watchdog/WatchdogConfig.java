package nl.pim16aap2.valheimkeeper.server.watchdog;

import java.time.Duration;
import java.util.Objects;

/**
 * Restart policy settings of the {@link Watchdog}.
 *
 * @param enabled
 *     Whether a crashed server is restarted automatically.
 * @param maxRestarts
 *     The number of consecutive restarts after which the watchdog gives up.
 * @param restartDelay
 *     The delay before the first restart.
 * @param cooldownPeriod
 *     How long the server has to stay online before the restart counter is reset.
 * @param backoffMultiplier
 *     The factor by which the delay grows with every consecutive restart.
 * @param readinessTimeout
 *     How long to wait for the server to report that it is ready before considering it online anyway.
 */
public record WatchdogConfig(
    boolean enabled,
    int maxRestarts,
    Duration restartDelay,
    Duration cooldownPeriod,
    double backoffMultiplier,
    Duration readinessTimeout)
{
    public static final Duration DEFAULT_READINESS_TIMEOUT = Duration.ofMinutes(3);

    public static final WatchdogConfig DEFAULTS = new WatchdogConfig(
        true, 5, Duration.ofSeconds(5), Duration.ofMinutes(5), 2.0D);

    public WatchdogConfig
    {
        Objects.requireNonNull(restartDelay, "restartDelay may not be null.");
        Objects.requireNonNull(cooldownPeriod, "cooldownPeriod may not be null.");
        Objects.requireNonNull(readinessTimeout, "readinessTimeout may not be null.");
        if (maxRestarts < 0)
            throw new IllegalArgumentException("maxRestarts may not be negative, got " + maxRestarts + ".");
        if (restartDelay.isNegative())
            throw new IllegalArgumentException("restartDelay may not be negative, got " + restartDelay + ".");
        if (cooldownPeriod.isNegative() || cooldownPeriod.isZero())
            throw new IllegalArgumentException("cooldownPeriod must be positive, got " + cooldownPeriod + ".");
        if (!(backoffMultiplier >= 1.0D))
            throw new IllegalArgumentException("backoffMultiplier must be at least 1, got " + backoffMultiplier + ".");
        if (readinessTimeout.isNegative() || readinessTimeout.isZero())
            throw new IllegalArgumentException("readinessTimeout must be positive, got " + readinessTimeout + ".");
    }

    public WatchdogConfig(
        boolean enabled, int maxRestarts, Duration restartDelay, Duration cooldownPeriod, double backoffMultiplier)
    {
        this(enabled, maxRestarts, restartDelay, cooldownPeriod, backoffMultiplier, DEFAULT_READINESS_TIMEOUT);
    }
}
