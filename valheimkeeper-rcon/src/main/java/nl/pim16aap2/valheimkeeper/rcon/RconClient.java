package nl.pim16aap2.valheimkeeper.rcon;

import lombok.extern.java.Log;
import nl.pim16aap2.valheimkeeper.rcon.protocol.RconPacket;
import nl.pim16aap2.valheimkeeper.rcon.protocol.RconPacketCodec;
import nl.pim16aap2.valheimkeeper.rcon.protocol.RconPacketType;
import nl.pim16aap2.valheimkeeper.rcon.protocol.RconProtocolException;
import org.jspecify.annotations.Nullable;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Blocking RCON client for a single server.
 * <p>
 * Requests are serialized: only one {@link #connect()} or {@link #send(String)} is in flight at any time.
 * {@link #disconnect()} may be called from any thread and unblocks a pending call.
 */
@Log
public final class RconClient implements RconConnection
{
    /**
     * Largest frame accepted from the server. Anything larger is treated as a corrupt stream.
     */
    static final int MAX_RECEIVE_FRAME_LENGTH = 1024 * 1024;

    private static final int READ_CHUNK_SIZE = 4096;

    private final String host;
    private final int port;
    private final String password;
    private final Duration timeout;

    private volatile @Nullable Socket socket;
    private volatile boolean authenticated;

    private byte[] receiveBuffer = new byte[READ_CHUNK_SIZE];
    private int receiveLength;
    private int lastId;

    public RconClient(String host, int port, String password, Duration timeout)
    {
        this.host = Objects.requireNonNull(host, "host may not be null.");
        this.password = Objects.requireNonNull(password, "password may not be null.");
        this.timeout = Objects.requireNonNull(timeout, "timeout may not be null.");
        if (port < 1 || port > 65_535)
            throw new IllegalArgumentException("Port must be between 1 and 65535, got " + port + ".");
        if (timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("Timeout must be positive, got " + timeout + ".");
        this.port = port;
    }

    public RconClient(RconManagerConfig config)
    {
        this(config.host(), config.port(), config.password(), config.timeout());
    }

    @Override
    public synchronized void connect()
        throws RconException
    {
        if (socket != null)
            throw new RconException(RconException.Reason.PROTOCOL_ERROR, "Client is already connected.");

        final Socket newSocket = new Socket();
        socket = newSocket;
        authenticated = false;
        receiveLength = 0;

        try
        {
            newSocket.connect(new InetSocketAddress(host, port), (int) timeout.toMillis());
        }
        catch (SocketTimeoutException exception)
        {
            dropConnection(newSocket);
            throw new RconException(
                RconException.Reason.TIMEOUT,
                "Timed out connecting to %s:%d.".formatted(host, port),
                exception
            );
        }
        catch (IOException exception)
        {
            final boolean disconnected = socket != newSocket;
            dropConnection(newSocket);
            if (disconnected)
                throw new RconException(RconException.Reason.DISCONNECTED, "Client was disconnected.", exception);
            throw new RconException(
                RconException.Reason.CONNECTION_REFUSED,
                "Failed to connect to %s:%d: %s".formatted(host, port, exception.getMessage()),
                exception
            );
        }

        final int authId = nextId();
        final RconPacket response = exchange(newSocket, authId, RconPacketType.AUTH, password, true);
        if (response.isAuthFailure())
        {
            dropConnection(newSocket);
            throw new RconException(
                RconException.Reason.AUTH_FAILED, "Authentication with %s:%d failed.".formatted(host, port));
        }

        if (socket != newSocket)
            throw new RconException(RconException.Reason.DISCONNECTED, "Client was disconnected.");
        authenticated = true;
        log.fine(() -> "Authenticated with RCON server %s:%d.".formatted(host, port));
    }

    @Override
    public synchronized String send(String command)
        throws RconException
    {
        final @Nullable Socket current = socket;
        if (current == null || !authenticated)
            throw new RconException(RconException.Reason.DISCONNECTED, "Client is not connected.");

        final int id = nextId();
        return exchange(current, id, RconPacketType.EXECCOMMAND, command, false).body();
    }

    @Override
    public void disconnect()
    {
        final @Nullable Socket current = socket;
        socket = null;
        authenticated = false;
        if (current != null)
            closeSocket(current);
    }

    @Override
    public boolean isConnected()
    {
        final @Nullable Socket current = socket;
        return authenticated && current != null && !current.isClosed();
    }

    /**
     * Writes a request and reads packets until the matching reply arrives.
     * <p>
     * For authentication the reply is the first AUTH_RESPONSE with the request id or the failure id. For commands it
     * is the first RESPONSE_VALUE with the request id. Everything else is discarded.
     */
    private RconPacket exchange(Socket target, int id, int type, String body, boolean authentication)
        throws RconException
    {
        final byte[] frame;
        try
        {
            frame = RconPacketCodec.encode(id, type, body);
        }
        catch (RconProtocolException exception)
        {
            if (authentication)
                dropConnection(target);
            throw new RconException(RconException.Reason.PROTOCOL_ERROR, exception.getMessage(), exception);
        }

        try
        {
            final OutputStream outputStream = target.getOutputStream();
            outputStream.write(frame);
            outputStream.flush();
        }
        catch (IOException exception)
        {
            dropConnection(target);
            throw new RconException(RconException.Reason.DISCONNECTED, "Failed to write to the server.", exception);
        }

        final long deadline = System.nanoTime() + timeout.toNanos();
        while (true)
        {
            final RconPacket packet = readPacket(target, deadline);
            if (authentication)
            {
                if (packet.type() == RconPacketType.AUTH_RESPONSE &&
                    (packet.id() == id || packet.id() == RconPacketType.AUTH_FAILURE_ID))
                    return packet;
            }
            else if (packet.type() == RconPacketType.RESPONSE_VALUE && packet.id() == id)
            {
                return packet;
            }
            log.finest(() -> "Discarding packet " + packet.id() + " of type " + packet.type() + ".");
        }
    }

    private RconPacket readPacket(Socket target, long deadline)
        throws RconException
    {
        try
        {
            while (!RconPacketCodec.hasCompletePacket(receiveBuffer, 0, receiveLength))
            {
                if (receiveLength >= RconPacketCodec.SIZE_FIELD_LENGTH &&
                    exceedsReceiveLimit(RconPacketCodec.frameLength(receiveBuffer, 0, receiveLength)))
                    throw new RconProtocolException(
                        RconProtocolException.Reason.INVALID_PACKET_SIZE, "Frame exceeds the receive limit.");

                final long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remaining <= 0)
                    throw new SocketTimeoutException("No response within " + timeout + ".");
                target.setSoTimeout((int) Math.min(Integer.MAX_VALUE, remaining));

                ensureCapacity(receiveLength + READ_CHUNK_SIZE);
                final InputStream inputStream = target.getInputStream();
                final int read = inputStream.read(receiveBuffer, receiveLength, READ_CHUNK_SIZE);
                if (read < 0)
                    throw new EOFException("Server closed the connection.");
                receiveLength += read;
            }

            final int frameLength = RconPacketCodec.frameLength(receiveBuffer, 0, receiveLength);
            final RconPacket packet = RconPacketCodec.decode(receiveBuffer, 0, receiveLength);
            receiveLength -= frameLength;
            System.arraycopy(receiveBuffer, frameLength, receiveBuffer, 0, receiveLength);
            return packet;
        }
        catch (SocketTimeoutException exception)
        {
            dropConnection(target);
            throw new RconException(RconException.Reason.TIMEOUT, "Timed out waiting for a response.", exception);
        }
        catch (RconProtocolException exception)
        {
            dropConnection(target);
            throw new RconException(RconException.Reason.PROTOCOL_ERROR, exception.getMessage(), exception);
        }
        catch (IOException exception)
        {
            dropConnection(target);
            throw new RconException(RconException.Reason.DISCONNECTED, "Connection to the server was lost.", exception);
        }
    }

    private static boolean exceedsReceiveLimit(int frameLength)
    {
        // A negative length means the declared size overflowed.
        return frameLength < 0 || frameLength > MAX_RECEIVE_FRAME_LENGTH;
    }

    private void ensureCapacity(int capacity)
    {
        if (receiveBuffer.length < capacity)
            receiveBuffer = Arrays.copyOf(receiveBuffer, Math.max(capacity, receiveBuffer.length * 2));
    }

    private int nextId()
    {
        lastId = lastId >= Integer.MAX_VALUE - 1 ? 1 : lastId + 1;
        return lastId;
    }

    private void dropConnection(Socket target)
    {
        if (socket == target)
        {
            socket = null;
            authenticated = false;
        }
        receiveLength = 0;
        closeSocket(target);
    }

    private static void closeSocket(Socket target)
    {
        try
        {
            target.close();
        }
        catch (IOException exception)
        {
            log.fine(() -> "Failed to close RCON socket cleanly: " + exception.getMessage());
        }
    }
}
