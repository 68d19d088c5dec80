package nl.pim16aap2.valheimkeeper.rcon;

/**
 * Connection state of an {@link RconManager}.
 */
public enum ConnectionState
{
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    /**
     * The last connection attempt failed. A reconnect may be pending.
     */
    ERROR
}
