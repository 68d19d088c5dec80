package nl.pim16aap2.valheimkeeper.rcon;

import nl.pim16aap2.valheimkeeper.rcon.protocol.RconPacket;
import nl.pim16aap2.valheimkeeper.rcon.protocol.RconPacketCodec;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Single-connection RCON server on the loopback interface.
 */
final class FakeRconServer implements AutoCloseable
{
    private final ServerSocket serverSocket;
    private final Handler handler;
    private final List<RconPacket> received = new CopyOnWriteArrayList<>();

    FakeRconServer(Handler handler)
        throws IOException
    {
        this.handler = handler;
        this.serverSocket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
        final Thread thread = new Thread(this::serve, "fake-rcon-server");
        thread.setDaemon(true);
        thread.start();
    }

    static String host()
    {
        return InetAddress.getLoopbackAddress().getHostAddress();
    }

    int port()
    {
        return serverSocket.getLocalPort();
    }

    List<RconPacket> received()
    {
        return received;
    }

    static void reply(OutputStream outputStream, int id, int type, String body)
        throws IOException
    {
        outputStream.write(RconPacketCodec.encode(id, type, body));
        outputStream.flush();
    }

    private void serve()
    {
        try (Socket socket = serverSocket.accept())
        {
            final DataInputStream inputStream = new DataInputStream(socket.getInputStream());
            final OutputStream outputStream = socket.getOutputStream();
            while (true)
            {
                final byte[] sizeField = new byte[4];
                inputStream.readFully(sizeField);
                final int size = ByteBuffer.wrap(sizeField).order(ByteOrder.LITTLE_ENDIAN).getInt();
                final byte[] frame = new byte[4 + size];
                System.arraycopy(sizeField, 0, frame, 0, 4);
                inputStream.readFully(frame, 4, size);

                final RconPacket request = RconPacketCodec.decode(frame);
                received.add(request);
                handler.handle(request, outputStream);
            }
        }
        catch (IOException exception)
        {
            // The client or the handler closed the connection.
        }
    }

    @Override
    public void close()
        throws IOException
    {
        serverSocket.close();
    }

    @FunctionalInterface
    interface Handler
    {
        /**
         * Handles one request. Throwing closes the connection.
         */
        void handle(RconPacket request, OutputStream outputStream)
            throws IOException;
    }
}
