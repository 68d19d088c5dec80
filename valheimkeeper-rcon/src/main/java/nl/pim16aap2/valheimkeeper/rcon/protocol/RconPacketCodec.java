package nl.pim16aap2.valheimkeeper.rcon.protocol;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Encodes and decodes RCON frames.
 * <p>
 * A frame looks as follows, with all integers in little-endian order:
 * <pre>
 * | size (int32) | id (int32) | type (int32) | body (n bytes) | 0x00 | 0x00 |
 * </pre>
 * The size field counts everything after itself, so the smallest frame (an empty body) declares a size of 10.
 */
public final class RconPacketCodec
{
    /**
     * Length of the size field that prefixes every frame.
     */
    public static final int SIZE_FIELD_LENGTH = 4;

    /**
     * Smallest valid value of the size field: id, type and the two terminators.
     */
    public static final int MIN_PACKET_SIZE = 10;

    /**
     * Largest body the client will send.
     */
    public static final int MAX_BODY_LENGTH = 4096;

    private static final int HEADER_LENGTH = 8;
    private static final int TERMINATOR_LENGTH = 2;

    private RconPacketCodec()
    {
    }

    /**
     * Encodes a packet into a frame.
     *
     * @param id
     *     The correlation id.
     * @param type
     *     The packet type.
     * @param body
     *     The body.
     * @return The frame.
     *
     * @throws RconProtocolException
     *     With reason {@link RconProtocolException.Reason#INVALID_BODY} when the body is longer than
     *     {@link #MAX_BODY_LENGTH} bytes or contains a NUL character.
     */
    public static byte[] encode(int id, int type, String body)
    {
        if (body.indexOf('\0') >= 0)
            throw new RconProtocolException(
                RconProtocolException.Reason.INVALID_BODY, "Packet body may not contain NUL characters.");

        final byte[] bodyBytes = body.getBytes(StandardCharsets.UTF_8);
        if (bodyBytes.length > MAX_BODY_LENGTH)
        {
            throw new RconProtocolException(
                RconProtocolException.Reason.INVALID_BODY,
                "Packet body of %d bytes exceeds the maximum of %d bytes.".formatted(bodyBytes.length, MAX_BODY_LENGTH)
            );
        }

        final int size = HEADER_LENGTH + bodyBytes.length + TERMINATOR_LENGTH;
        return ByteBuffer.allocate(SIZE_FIELD_LENGTH + size)
            .order(ByteOrder.LITTLE_ENDIAN)
            .putInt(size)
            .putInt(id)
            .putInt(type)
            .put(bodyBytes)
            .put((byte) 0)
            .put((byte) 0)
            .array();
    }

    public static byte[] encode(RconPacket packet)
    {
        return encode(packet.id(), packet.type(), packet.body());
    }

    public static RconPacket decode(byte[] buffer)
    {
        return decode(buffer, 0, buffer.length);
    }

    /**
     * Decodes the frame at the start of a region of a buffer.
     * <p>
     * Bytes beyond the end of the first frame are ignored; use {@link #frameLength(byte[], int, int)} to find out how
     * many bytes were consumed.
     *
     * @param buffer
     *     The buffer holding the frame.
     * @param offset
     *     The offset of the frame in the buffer.
     * @param length
     *     The number of readable bytes starting at the offset.
     * @return The decoded packet.
     *
     * @throws RconProtocolException
     *     With reason {@link RconProtocolException.Reason#BUFFER_TOO_SMALL} when the region is shorter than 10 bytes or
     *     than the declared frame, or {@link RconProtocolException.Reason#INVALID_PACKET_SIZE} when the declared size
     *     is below {@link #MIN_PACKET_SIZE}.
     */
    public static RconPacket decode(byte[] buffer, int offset, int length)
    {
        if (length < SIZE_FIELD_LENGTH)
        {
            throw new RconProtocolException(
                RconProtocolException.Reason.BUFFER_TOO_SMALL,
                "Buffer of %d bytes is too small to contain a packet size.".formatted(length)
            );
        }

        final ByteBuffer view = ByteBuffer.wrap(buffer, offset, length).order(ByteOrder.LITTLE_ENDIAN);
        final int size = view.getInt();
        if (size < MIN_PACKET_SIZE)
        {
            throw new RconProtocolException(
                RconProtocolException.Reason.INVALID_PACKET_SIZE, "Invalid packet size: %d.".formatted(size));
        }

        if (length < MIN_PACKET_SIZE || (long) length < (long) SIZE_FIELD_LENGTH + size)
        {
            throw new RconProtocolException(
                RconProtocolException.Reason.BUFFER_TOO_SMALL,
                "Buffer too small: expected %d bytes, got %d.".formatted((long) SIZE_FIELD_LENGTH + size, length)
            );
        }

        final int id = view.getInt();
        final int type = view.getInt();
        final int bodyOffset = offset + SIZE_FIELD_LENGTH + HEADER_LENGTH;
        final int bodyLength = size - HEADER_LENGTH - TERMINATOR_LENGTH;
        final String body = new String(buffer, bodyOffset, bodyLength, StandardCharsets.UTF_8);
        return new RconPacket(id, type, body);
    }

    public static boolean hasCompletePacket(byte[] buffer)
    {
        return hasCompletePacket(buffer, 0, buffer.length);
    }

    /**
     * Checks whether a region of a buffer starts with a complete frame, without consuming anything.
     *
     * @param buffer
     *     The buffer.
     * @param offset
     *     The start of the region.
     * @param length
     *     The number of readable bytes in the region.
     * @return True if at least 4 bytes are present and at least 4 + the declared size bytes are present.
     */
    public static boolean hasCompletePacket(byte[] buffer, int offset, int length)
    {
        if (length < SIZE_FIELD_LENGTH)
            return false;
        final int size = readSize(buffer, offset);
        return (long) length >= (long) SIZE_FIELD_LENGTH + size;
    }

    /**
     * Gets the total length of the frame at the start of a region, including the size field.
     *
     * @param buffer
     *     The buffer.
     * @param offset
     *     The start of the frame.
     * @param length
     *     The number of readable bytes in the region. Must be at least 4.
     * @return The frame length.
     */
    public static int frameLength(byte[] buffer, int offset, int length)
    {
        if (length < SIZE_FIELD_LENGTH)
            throw new IllegalArgumentException("Need at least 4 bytes to read the frame length, got " + length + ".");
        return SIZE_FIELD_LENGTH + readSize(buffer, offset);
    }

    public static boolean isValidBody(String body)
    {
        return body.indexOf('\0') < 0 && body.getBytes(StandardCharsets.UTF_8).length <= MAX_BODY_LENGTH;
    }

    private static int readSize(byte[] buffer, int offset)
    {
        return ByteBuffer.wrap(buffer, offset, SIZE_FIELD_LENGTH).order(ByteOrder.LITTLE_ENDIAN).getInt();
    }
}
