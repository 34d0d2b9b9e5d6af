package org.abstractica.messaging.impl.client;

import org.abstractica.messaging.ConnectionState;
import org.abstractica.messaging.StreamClient;
import org.abstractica.messaging.errors.ConfigurationException;
import org.abstractica.messaging.errors.ConnectionFailedException;
import org.abstractica.messaging.errors.SendException;
import org.abstractica.messaging.impl.framing.FrameCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultStreamClient against a plain socket acting as server.
 */
class DefaultStreamClientTest
{
    private static final Duration POLL = Duration.ofMillis(20);

    private ServerSocketChannel listener;
    private SocketChannel serverSide;
    private StreamClient client;

    @BeforeEach
    void setUp() throws IOException
    {
        listener = ServerSocketChannel.open();
        listener.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
        client = clientFor(listenerPort());
    }

    @AfterEach
    void tearDown() throws IOException
    {
        client.close();
        if (serverSide != null)
        {
            serverSide.close();
        }
        listener.close();
    }

    private int listenerPort() throws IOException
    {
        return ((InetSocketAddress) listener.getLocalAddress()).getPort();
    }

    private static StreamClient clientFor(int port)
    {
        return new DefaultStreamClientFactory().builder()
                .serverAddress("127.0.0.1", port)
                .pollTimeout(POLL)
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    private void connectAndAccept() throws IOException
    {
        client.connect();
        serverSide = listener.accept();
        serverSide.socket().setSoTimeout(2000);
    }

    private void serverWrite(String message) throws IOException
    {
        ByteBuffer frame = ByteBuffer.wrap(FrameCodec.encode(message, 4));
        while (frame.hasRemaining())
        {
            serverSide.write(frame);
        }
    }

    private String serverRead() throws IOException
    {
        InputStream in = serverSide.socket().getInputStream();
        return FrameCodec.decode(in::read, 4);
    }

    private List<String> awaitMessages(int count) throws InterruptedException
    {
        List<String> received = new ArrayList<>();
        long deadline = System.currentTimeMillis() + 2000;
        while (received.size() < count && System.currentTimeMillis() < deadline)
        {
            received.addAll(client.getMessages());
            Thread.sleep(5);
        }
        return received;
    }

    private static boolean await(BooleanSupplier condition) throws InterruptedException
    {
        long deadline = System.currentTimeMillis() + 2000;
        while (System.currentTimeMillis() < deadline)
        {
            if (condition.getAsBoolean())
            {
                return true;
            }
            Thread.sleep(5);
        }
        return false;
    }

    // ========== Connecting ==========

    @Test
    void newClient_isIdle()
    {
        assertEquals(ConnectionState.IDLE, client.getState());
        assertEquals("127.0.0.1", client.getServer().host());
        assertNull(client.getLocalAddress());
        assertTrue(client.getMessages().isEmpty());
        assertFalse(client.isReceiving());
    }

    @Test
    void connect_becomesActive() throws IOException
    {
        connectAndAccept();

        assertEquals(ConnectionState.ACTIVE, client.getState());
        assertEquals(serverSide.getRemoteAddress(), client.getLocalAddress());
    }

    @Test
    void connect_twice_throws() throws IOException
    {
        connectAndAccept();

        assertThrows(IllegalStateException.class, () -> client.connect());
    }

    @Test
    void connect_nothingListening_throwsConnectionFailed() throws IOException
    {
        int port = listenerPort();
        listener.close();
        client = clientFor(port);

        ConnectionFailedException e = assertThrows(ConnectionFailedException.class, () -> client.connect());
        assertEquals(port, e.getServer().port());
        assertInstanceOf(IOException.class, e.getCause());
        assertEquals(ConnectionState.IDLE, client.getState());
    }

    @Test
    void operations_beforeConnect_throw()
    {
        assertThrows(IllegalStateException.class, () -> client.send("hi"));
        assertThrows(IllegalStateException.class, () -> client.startReceiving());
    }

    @Test
    void stopReceiving_beforeConnect_isNoOp()
    {
        client.stopReceiving();

        assertEquals(ConnectionState.IDLE, client.getState());
    }

    // ========== Messaging ==========

    @Test
    void send_arrivesInOrder() throws IOException
    {
        connectAndAccept();

        client.send("first");
        client.send("second");
        client.send("");

        assertEquals("first", serverRead());
        assertEquals("second", serverRead());
        assertEquals("", serverRead());
    }

    @Test
    void receive_queuesServerMessagesInOrder() throws Exception
    {
        connectAndAccept();
        client.startReceiving();
        assertTrue(client.isReceiving());

        serverWrite("alpha");
        serverWrite("beta");
        serverWrite("gamma");

        assertEquals(List.of("alpha", "beta", "gamma"), awaitMessages(3));
    }

    @Test
    void startReceiving_twice_isNoOp() throws Exception
    {
        connectAndAccept();
        client.startReceiving();
        client.startReceiving();

        serverWrite("once");

        assertEquals(List.of("once"), awaitMessages(1));
        Thread.sleep(50);
        assertTrue(client.getMessages().isEmpty());
    }

    @Test
    void stopReceiving_thenRestart_resumesWithoutLoss() throws Exception
    {
        connectAndAccept();
        client.startReceiving();
        client.stopReceiving();
        assertFalse(client.isReceiving());

        serverWrite("while stopped");
        Thread.sleep(50);
        assertTrue(client.getMessages().isEmpty());

        client.startReceiving();
        assertEquals(List.of("while stopped"), awaitMessages(1));
        assertEquals(ConnectionState.ACTIVE, client.getState());
    }

    // ========== Disconnect ==========

    @Test
    void serverCloses_clientDetectsClosed() throws Exception
    {
        connectAndAccept();
        client.startReceiving();

        serverSide.close();

        assertTrue(await(() -> client.getState() == ConnectionState.CLOSED));
        assertTrue(await(() -> !client.isReceiving()));
        assertThrows(SendException.class, () -> client.send("anyone there?"));
    }

    // ========== Lifecycle ==========

    @Test
    void close_shutsConnectionAndIsIdempotent() throws Exception
    {
        connectAndAccept();
        client.startReceiving();

        client.close();
        client.close();

        assertEquals(ConnectionState.CLOSED, client.getState());
        assertFalse(client.isReceiving());
        assertEquals(-1, serverSide.socket().getInputStream().read());
        assertThrows(IllegalStateException.class, () -> client.connect());
    }

    @Test
    void close_beforeConnect_marksClosed()
    {
        client.close();

        assertEquals(ConnectionState.CLOSED, client.getState());
        assertThrows(IllegalStateException.class, () -> client.connect());
    }

    // ========== Configuration ==========

    @Test
    void build_withoutServerAddress_throws()
    {
        assertThrows(ConfigurationException.class, () -> new DefaultStreamClientFactory().builder().build());
    }

    @Test
    void serverAddress_invalid_throws()
    {
        DefaultStreamClientFactory factory = new DefaultStreamClientFactory();

        assertThrows(ConfigurationException.class, () -> factory.builder().serverAddress(" ", 1024));
        assertThrows(ConfigurationException.class, () -> factory.builder().serverAddress(null, 1024));
        assertThrows(ConfigurationException.class, () -> factory.builder().serverAddress("localhost", 0));
        assertThrows(ConfigurationException.class, () -> factory.builder().serverAddress("localhost", 70000));
    }

    @Test
    void timeouts_invalid_throw()
    {
        DefaultStreamClientFactory factory = new DefaultStreamClientFactory();

        assertThrows(ConfigurationException.class, () -> factory.builder().connectTimeout(Duration.ZERO));
        assertThrows(ConfigurationException.class, () -> factory.builder().pollTimeout(null));
    }
}
