package nl.pim16aap2.valheimkeeper.rcon;

/**
 * A single authenticated RCON session.
 */
public interface RconConnection
{
    /**
     * Opens the socket and authenticates.
     *
     * @throws RconException
     *     When the connection could not be established or the password was rejected.
     */
    void connect()
        throws RconException;

    /**
     * Executes a command and waits for its response.
     *
     * @param command
     *     The command text.
     * @return The response body.
     *
     * @throws RconException
     *     When the command could not be executed.
     */
    String send(String command)
        throws RconException;

    /**
     * Closes the connection. Calling this while another thread is blocked in {@link #send(String)} makes that call
     * fail.
     */
    void disconnect();

    boolean isConnected();
}
