package nl.pim16aap2.valheimkeeper.rcon;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Thrown when an RCON operation fails.
 */
@Getter
@Accessors(fluent = true)
public final class RconException extends Exception
{
    private final Reason reason;

    public RconException(Reason reason, String message)
    {
        super(message);
        this.reason = reason;
    }

    public RconException(Reason reason, String message, Throwable cause)
    {
        super(message, cause);
        this.reason = reason;
    }

    public enum Reason
    {
        /**
         * The connection is not open, or it was closed by the server.
         */
        DISCONNECTED,
        /**
         * The server rejected the password.
         */
        AUTH_FAILED,
        /**
         * The server did not answer in time.
         */
        TIMEOUT,
        /**
         * The socket could not be opened.
         */
        CONNECTION_REFUSED,
        /**
         * The client was used incorrectly or the server sent something that could not be understood.
         */
        PROTOCOL_ERROR
    }
}
