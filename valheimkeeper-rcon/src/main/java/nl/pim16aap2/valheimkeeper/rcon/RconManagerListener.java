package nl.pim16aap2.valheimkeeper.rcon;

import java.util.List;

/**
 * Receives state changes and player-list updates from an {@link RconManager}.
 */
public interface RconManagerListener
{
    default void onConnectionStateChange(ConnectionState state)
    {
    }

    /**
     * Called after every successful player-list poll.
     *
     * @param players
     *     The names of the players currently online. Never null.
     */
    default void onPlayerListUpdate(List<String> players)
    {
    }
}
