package nl.pim16aap2.valheimkeeper.rcon;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings of an {@link RconManager}.
 *
 * @param host
 *     The host name of the RCON server.
 * @param port
 *     The TCP port of the RCON server.
 * @param password
 *     The RCON password. May be empty.
 * @param timeout
 *     The connect and response timeout.
 * @param enabled
 *     Whether the manager may connect at all.
 * @param autoReconnect
 *     Whether a lost or failed connection is retried.
 * @param pollInterval
 *     The delay between two player-list polls.
 */
public record RconManagerConfig(
    String host,
    int port,
    String password,
    Duration timeout,
    boolean enabled,
    boolean autoReconnect,
    Duration pollInterval)
{
    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 25_575;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(5_000);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(10);

    public RconManagerConfig
    {
        Objects.requireNonNull(host, "host may not be null.");
        Objects.requireNonNull(password, "password may not be null.");
        Objects.requireNonNull(timeout, "timeout may not be null.");
        Objects.requireNonNull(pollInterval, "pollInterval may not be null.");
        if (port < 1 || port > 65_535)
            throw new IllegalArgumentException("Port must be between 1 and 65535, got " + port + ".");
        if (timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("Timeout must be positive, got " + timeout + ".");
        if (pollInterval.isNegative() || pollInterval.isZero())
            throw new IllegalArgumentException("Poll interval must be positive, got " + pollInterval + ".");
    }

    public RconManagerConfig(String host, int port, String password, boolean enabled, boolean autoReconnect)
    {
        this(host, port, password, DEFAULT_TIMEOUT, enabled, autoReconnect, DEFAULT_POLL_INTERVAL);
    }

    /**
     * Checks whether another config points at the same server with the same credentials.
     *
     * @param other
     *     The config to compare with.
     * @return True if host, port and password are equal.
     */
    public boolean sameEndpoint(RconManagerConfig other)
    {
        return host.equals(other.host) && port == other.port && password.equals(other.password);
    }

    @Override
    public String toString()
    {
        return "RconManagerConfig[host=%s, port=%d, timeout=%s, enabled=%s, autoReconnect=%s, pollInterval=%s]"
            .formatted(host, port, timeout, enabled, autoReconnect, pollInterval);
    }
}
