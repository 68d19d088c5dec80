package nl.pim16aap2.valheimkeeper.server.watchdog;

/**
 * Reported when the server logs an error or exits unexpectedly.
 */
public class ServerErrorException extends Exception
{
    public ServerErrorException(String message)
    {
        super(message);
    }
}
