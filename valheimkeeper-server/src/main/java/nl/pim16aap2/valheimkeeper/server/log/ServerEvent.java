package nl.pim16aap2.valheimkeeper.server.log;

import java.util.Objects;

/**
 * Something noteworthy that was detected in the server log.
 */
public interface ServerEvent
{
    /**
     * A character was spawned for a player.
     */
    record PlayerJoined(String name) implements ServerEvent
    {
        public PlayerJoined
        {
            Objects.requireNonNull(name, "name may not be null.");
        }
    }

    /**
     * A player whose session was known was disconnected.
     * <p>
     * This event is never parsed directly from a line; it is derived from {@link PlayerDisconnected}.
     */
    record PlayerLeft(String name) implements ServerEvent
    {
        public PlayerLeft
        {
            Objects.requireNonNull(name, "name may not be null.");
        }
    }

    /**
     * A client opened a connection.
     */
    record PlayerConnecting(String steamId) implements ServerEvent
    {
        public PlayerConnecting
        {
            Objects.requireNonNull(steamId, "steamId may not be null.");
        }
    }

    /**
     * A client connection was closed.
     */
    record PlayerDisconnected(String steamId) implements ServerEvent
    {
        public PlayerDisconnected
        {
            Objects.requireNonNull(steamId, "steamId may not be null.");
        }
    }

    record WorldSaved() implements ServerEvent
    {
    }

    record WorldGenerated() implements ServerEvent
    {
    }

    /**
     * The server registered with the matchmaking backend and accepts players.
     */
    record ServerReady() implements ServerEvent
    {
    }

    record ServerShutdown() implements ServerEvent
    {
    }

    record ErrorLogged(String message) implements ServerEvent
    {
        public ErrorLogged
        {
            Objects.requireNonNull(message, "message may not be null.");
        }
    }

    record StartupPhaseChanged(StartupPhase phase) implements ServerEvent
    {
        public StartupPhaseChanged
        {
            Objects.requireNonNull(phase, "phase may not be null.");
        }
    }
}
