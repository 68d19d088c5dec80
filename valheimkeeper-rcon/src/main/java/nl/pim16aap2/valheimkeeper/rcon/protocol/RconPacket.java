package nl.pim16aap2.valheimkeeper.rcon.protocol;

import java.util.Objects;

/**
 * A single RCON packet.
 *
 * @param id
 *     Correlation id chosen by the client.
 * @param type
 *     One of the {@link RconPacketType} constants.
 * @param body
 *     The packet body, without terminators.
 */
public record RconPacket(int id, int type, String body)
{
    public RconPacket
    {
        Objects.requireNonNull(body, "body may not be null.");
    }

    public boolean isAuthFailure()
    {
        return type == RconPacketType.AUTH_RESPONSE && id == RconPacketType.AUTH_FAILURE_ID;
    }
}
