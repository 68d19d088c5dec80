package nl.pim16aap2.valheimkeeper.rcon.protocol;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Thrown when a packet cannot be encoded or decoded.
 */
@Getter
@Accessors(fluent = true)
public final class RconProtocolException extends RuntimeException
{
    private final Reason reason;

    public RconProtocolException(Reason reason, String message)
    {
        super(message);
        this.reason = reason;
    }

    public enum Reason
    {
        /**
         * The body is too long or contains a terminator byte.
         */
        INVALID_BODY,

        /**
         * The buffer holds fewer bytes than the frame requires.
         */
        BUFFER_TOO_SMALL,

        /**
         * The declared size is below the protocol minimum.
         */
        INVALID_PACKET_SIZE
    }
}
