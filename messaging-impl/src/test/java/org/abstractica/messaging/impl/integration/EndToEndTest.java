package org.abstractica.messaging.impl.integration;

import org.abstractica.messaging.BroadcastResult;
import org.abstractica.messaging.DatagramEndpoint;
import org.abstractica.messaging.DatagramMessage;
import org.abstractica.messaging.Peer;
import org.abstractica.messaging.StreamClient;
import org.abstractica.messaging.StreamServer;
import org.abstractica.messaging.impl.client.DefaultStreamClientFactory;
import org.abstractica.messaging.impl.datagram.DefaultDatagramEndpointFactory;
import org.abstractica.messaging.impl.server.DefaultStreamServerFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests through the public factories.
 */
class EndToEndTest
{
    // ========== Test Setup ==========

    private static final Duration POLL = Duration.ofMillis(20);

    private StreamServer server;
    private final List<StreamClient> clients = new ArrayList<>();
    private final List<DatagramEndpoint> endpoints = new ArrayList<>();

    @AfterEach
    void tearDown()
    {
        for (StreamClient client : clients)
        {
            client.close();
        }
        if (server != null)
        {
            server.close();
        }
        for (DatagramEndpoint endpoint : endpoints)
        {
            endpoint.stopListeningForMessages();
            endpoint.close();
        }
    }

    private StreamServer startServer(int headerWidth)
    {
        server = new DefaultStreamServerFactory().builder()
                .bindAddress(InetAddress.getLoopbackAddress())
                .port(0)
                .headerWidth(headerWidth)
                .pollTimeout(POLL)
                .build();
        server.listenForConnections();
        return server;
    }

    private StreamClient connect(int headerWidth)
    {
        int port = ((InetSocketAddress) server.getLocalAddress()).getPort();
        StreamClient client = new DefaultStreamClientFactory().builder()
                .serverAddress("127.0.0.1", port)
                .headerWidth(headerWidth)
                .pollTimeout(POLL)
                .build();
        clients.add(client);
        client.connect();
        return client;
    }

    private static <T> T awaitValue(Supplier<T> supplier, Predicate<T> done)
            throws InterruptedException
    {
        long deadline = System.currentTimeMillis() + 3000;
        T value = supplier.get();
        while (!done.test(value) && System.currentTimeMillis() < deadline)
        {
            Thread.sleep(5);
            value = supplier.get();
        }
        return value;
    }

    // ========== Stream Tests ==========

    @Test
    void threeClients_eachMessageAttributedToItsPeer() throws Exception
    {
        startServer(4);
        List<StreamClient> connected = List.of(connect(4), connect(4), connect(4));

        List<Peer> peers = new ArrayList<>();
        awaitValue(() ->
        {
            peers.addAll(server.drainNewConnections());
            return peers.size();
        }, size -> size == 3);
        assertEquals(3, peers.size());

        server.listenForMessages();
        Map<Peer, String> expected = new HashMap<>();
        for (int i = 0; i < connected.size(); i++)
        {
            StreamClient client = connected.get(i);
            client.send("hello from " + i);
            expected.put(Peer.of((InetSocketAddress) client.getLocalAddress()), "hello from " + i);
        }

        Map<Peer, List<String>> collected = new HashMap<>();
        awaitValue(() ->
        {
            server.getAllMessages().forEach((peer, messages) ->
                    collected.computeIfAbsent(peer, p -> new ArrayList<>()).addAll(messages));
            return collected.values().stream().mapToInt(List::size).sum();
        }, total -> total == 3);

        assertEquals(expected.keySet(), collected.keySet());
        expected.forEach((peer, message) -> assertEquals(List.of(message), collected.get(peer)));
    }

    @Test
    void echoServer_roundTripsWithNarrowHeader() throws Exception
    {
        startServer(2);
        StreamClient client = connect(2);
        client.startReceiving();

        List<Peer> peers = awaitValue(server::drainNewConnections, list -> !list.isEmpty());
        Peer peer = peers.get(0);
        server.listenForMessages();

        CountDownLatch echoed = new CountDownLatch(3);
        Thread echo = new Thread(() ->
        {
            long deadline = System.currentTimeMillis() + 3000;
            while (echoed.getCount() > 0 && System.currentTimeMillis() < deadline)
            {
                for (String message : server.getMessagesFrom(peer))
                {
                    server.sendTo(peer, "echo: " + message);
                    echoed.countDown();
                }
                Thread.onSpinWait();
            }
        });
        echo.start();

        client.send("a");
        client.send("b".repeat(1000));
        client.send("ü");

        assertTrue(echoed.await(3, TimeUnit.SECONDS));
        echo.join();

        List<String> replies = new ArrayList<>();
        awaitValue(() ->
        {
            replies.addAll(client.getMessages());
            return replies.size();
        }, size -> size == 3);
        assertEquals(List.of("echo: a", "echo: " + "b".repeat(1000), "echo: ü"), replies);
    }

    @Test
    void broadcast_afterClientLeaves_reachesRemainingClients() throws Exception
    {
        startServer(4);
        server.listenForMessages();
        StreamClient stays = connect(4);
        StreamClient leaves = connect(4);
        stays.startReceiving();
        Peer leavingPeer = Peer.of((InetSocketAddress) leaves.getLocalAddress());

        List<Peer> peers = new ArrayList<>();
        awaitValue(() ->
        {
            peers.addAll(server.drainNewConnections());
            return peers.size();
        }, size -> size == 2);

        leaves.close();
        List<Peer> dropped = awaitValue(server::dropClosedPeers, list -> !list.isEmpty());
        assertEquals(List.of(leavingPeer), dropped);

        BroadcastResult result = server.sendToAll("news");
        assertTrue(result.isSuccess());
        assertEquals(1, result.delivered().size());

        List<String> received = awaitValue(stays::getMessages, list -> !list.isEmpty());
        assertEquals(List.of("news"), received);
    }

    // ========== Datagram Tests ==========

    @Test
    void datagramPing_arrivesWithSenderAddress() throws Exception
    {
        DatagramEndpoint a = datagramEndpoint();
        DatagramEndpoint b = datagramEndpoint();
        b.listenForMessages();

        a.send("ping", "127.0.0.1", b.getLocalPeer().port());

        List<DatagramMessage> received = awaitValue(b::getMessages, list -> !list.isEmpty());
        assertEquals(List.of(new DatagramMessage("ping", a.getLocalPeer())), received);
    }

    private DatagramEndpoint datagramEndpoint()
    {
        DatagramEndpoint endpoint = new DefaultDatagramEndpointFactory().builder()
                .bindAddress(InetAddress.getLoopbackAddress())
                .port(0)
                .pollTimeout(POLL)
                .build();
        endpoints.add(endpoint);
        return endpoint;
    }
}
