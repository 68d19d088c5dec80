package nl.pim16aap2.valheimkeeper.server.process;

/**
 * Thrown when the server process could not be started.
 */
public class ProcessSpawnFailedException extends Exception
{
    public ProcessSpawnFailedException(String message)
    {
        super(message);
    }

    public ProcessSpawnFailedException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
