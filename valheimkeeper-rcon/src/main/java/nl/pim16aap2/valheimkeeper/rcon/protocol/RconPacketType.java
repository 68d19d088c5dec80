package nl.pim16aap2.valheimkeeper.rcon.protocol;

/**
 * Packet type constants of the Source RCON protocol.
 * <p>
 * {@link #AUTH_RESPONSE} and {@link #EXECCOMMAND} share the same value; they are told apart by direction.
 */
public final class RconPacketType
{
    /**
     * Client to server: authentication request carrying the password.
     */
    public static final int AUTH = 3;

    /**
     * Server to client: result of an authentication request.
     */
    public static final int AUTH_RESPONSE = 2;

    /**
     * Client to server: console command.
     */
    public static final int EXECCOMMAND = 2;

    /**
     * Server to client: command output.
     */
    public static final int RESPONSE_VALUE = 0;

    /**
     * Id the server echoes in an {@link #AUTH_RESPONSE} when the password was rejected.
     */
    public static final int AUTH_FAILURE_ID = -1;

    private RconPacketType()
    {
    }
}
