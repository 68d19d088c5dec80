package nl.pim16aap2.valheimkeeper.server.process;

import com.google.errorprone.annotations.concurrent.GuardedBy;
import org.jspecify.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Keeps track of who is online, based on the connection lines of the server log.
 * <p>
 * The server logs the SteamID of a connection when it is opened and closed, but only logs the character name when
 * the character spawns. A spawn is attributed to the oldest connection that does not have a character yet, which
 * lets a closed connection be translated back into the name of the player that left.
 */
public final class PlayerSessionTracker
{
    @GuardedBy("this")
    private final Deque<String> pendingConnections = new ArrayDeque<>();
    /**
     * Player name to SteamID, in join order. The SteamID is empty when the connection was not seen.
     */
    @GuardedBy("this")
    private final Map<String, String> sessions = new LinkedHashMap<>();

    /**
     * Records a new connection.
     *
     * @param steamId
     *     The SteamID of the connection.
     */
    public synchronized void connecting(String steamId)
    {
        Objects.requireNonNull(steamId, "steamId may not be null.");
        if (!pendingConnections.contains(steamId) && !sessions.containsValue(steamId))
            pendingConnections.addLast(steamId);
    }

    /**
     * Records that the character of a player spawned.
     *
     * @param name
     *     The name of the character.
     * @return True if this started a new session, false if the player was already online (for example after a
     *     respawn).
     */
    public synchronized boolean joined(String name)
    {
        Objects.requireNonNull(name, "name may not be null.");
        if (sessions.containsKey(name))
            return false;
        final @Nullable String steamId = pendingConnections.pollFirst();
        sessions.put(name, steamId == null ? "" : steamId);
        return true;
    }

    /**
     * Records that a connection was closed.
     *
     * @param steamId
     *     The SteamID of the connection.
     * @return The name of the player that left, or null if the connection never had a character.
     */
    public synchronized @Nullable String disconnected(String steamId)
    {
        Objects.requireNonNull(steamId, "steamId may not be null.");
        pendingConnections.remove(steamId);
        for (final Map.Entry<String, String> session : sessions.entrySet())
        {
            if (session.getValue().equals(steamId))
            {
                final String name = session.getKey();
                sessions.remove(name);
                return name;
            }
        }
        return null;
    }

    /**
     * @return The names of the online players, in join order.
     */
    public synchronized List<String> onlinePlayers()
    {
        return List.copyOf(new ArrayList<>(sessions.keySet()));
    }

    public synchronized void clear()
    {
        pendingConnections.clear();
        sessions.clear();
    }
}
