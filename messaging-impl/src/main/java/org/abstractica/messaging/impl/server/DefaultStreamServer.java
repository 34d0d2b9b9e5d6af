package org.abstractica.messaging.impl.server;

import org.abstractica.messaging.BroadcastResult;
import org.abstractica.messaging.ConnectionState;
import org.abstractica.messaging.Peer;
import org.abstractica.messaging.StreamServer;
import org.abstractica.messaging.errors.EndpointBindException;
import org.abstractica.messaging.errors.SendException;
import org.abstractica.messaging.errors.UnknownPeerException;
import org.abstractica.messaging.impl.connection.PeerConnection;
import org.abstractica.messaging.impl.loop.PollingLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Default implementation of the StreamServer interface.
 *
 * <p>The accept loop only produces into the pending queue. The registry is
 * changed by the application thread alone, when it drains new connections or
 * drops peers.</p>
 */
public class DefaultStreamServer implements StreamServer
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultStreamServer.class);

    private final ServerSocketChannel serverChannel;
    private final Selector acceptSelector;
    private final SocketAddress localAddress;
    private final int headerWidth;
    private final int maxFrameSize;
    private final Duration pollTimeout;
    private final long pollTimeoutMs;

    private final PollingLoop acceptLoop;
    private final BlockingQueue<PendingConnection> pendingConnections = new LinkedBlockingQueue<>();
    private final Map<Peer, PeerConnection> registry = new ConcurrentHashMap<>();

    private volatile boolean listeningForMessages;
    private volatile boolean closed;

    /**
     * Creates and binds a server.
     *
     * <p>Use {@link DefaultStreamServerFactory} to create instances.</p>
     *
     * @throws EndpointBindException if the address cannot be bound
     */
    DefaultStreamServer(
            InetSocketAddress bindAddress,
            int backlog,
            int headerWidth,
            int maxFrameSize,
            Duration pollTimeout
    )
    {
        Objects.requireNonNull(bindAddress, "bindAddress");
        this.headerWidth = headerWidth;
        this.maxFrameSize = maxFrameSize;
        this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout");
        this.pollTimeoutMs = Math.max(1, pollTimeout.toMillis());

        ServerSocketChannel channel = null;
        Selector selector = null;
        SocketAddress bound;
        try
        {
            channel = ServerSocketChannel.open();
            channel.configureBlocking(false);
            channel.bind(bindAddress, backlog);
            selector = Selector.open();
            channel.register(selector, SelectionKey.OP_ACCEPT);
            bound = channel.getLocalAddress();
        }
        catch (IOException e)
        {
            closeQuietly(selector);
            closeQuietly(channel);
            throw new EndpointBindException(bindAddress, e);
        }
        this.serverChannel = channel;
        this.acceptSelector = selector;
        this.localAddress = bound;

        this.acceptLoop = new PollingLoop("stream-accept-" + localAddress, this::acceptOnce,
                e -> LOG.error("Accept loop on {} failed", localAddress, e));

        LOG.info("Stream server bound to {}", localAddress);
    }

    // ========== Accepting ==========

    @Override
    public void listenForConnections()
    {
        if (closed)
        {
            throw new IllegalStateException("Server is closed");
        }
        if (acceptLoop.start())
        {
            LOG.info("Listening for connections on {}", localAddress);
        }
    }

    @Override
    public void stopListeningForConnections()
    {
        if (acceptLoop.isRunning())
        {
            acceptLoop.stop();
            LOG.info("Stopped listening for connections on {}", localAddress);
        }
    }

    @Override
    public boolean isListeningForConnections()
    {
        return acceptLoop.isRunning();
    }

    private boolean acceptOnce() throws IOException
    {
        if (acceptSelector.select(pollTimeoutMs) == 0)
        {
            return true;
        }
        acceptSelector.selectedKeys().clear();

        SocketChannel accepted = serverChannel.accept();
        if (accepted == null)
        {
            return true;
        }

        try
        {
            PeerConnection connection = new PeerConnection(accepted, headerWidth, maxFrameSize, pollTimeout);
            pendingConnections.add(new PendingConnection(connection, connection.getPeer()));
            LOG.debug("Accepted connection from {}", connection.getPeer());
        }
        catch (IOException e)
        {
            LOG.warn("Failed to set up accepted connection: {}", e.getMessage());
            closeQuietly(accepted);
        }
        return true;
    }

    @Override
    public List<Peer> drainNewConnections()
    {
        List<PendingConnection> batch = new ArrayList<>();
        pendingConnections.drainTo(batch);

        List<Peer> admitted = new ArrayList<>(batch.size());
        for (PendingConnection pending : batch)
        {
            PeerConnection previous = registry.put(pending.peer(), pending.connection());
            if (previous != null)
            {
                LOG.warn("Replacing stale connection for {}", pending.peer());
                previous.close();
            }
            if (listeningForMessages)
            {
                pending.connection().startReceiving();
            }
            admitted.add(pending.peer());
            LOG.info("Admitted peer {}", pending.peer());
        }
        return admitted;
    }

    // ========== Receiving ==========

    @Override
    public void listenForMessages()
    {
        listeningForMessages = true;
        for (PeerConnection connection : registry.values())
        {
            if (connection.startReceiving())
            {
                LOG.debug("Started receiving from {}", connection.getPeer());
            }
        }
    }

    @Override
    public void stopListeningForMessages()
    {
        listeningForMessages = false;

        // Signal every loop first so they wind down in parallel
        List<PeerConnection> connections = new ArrayList<>(registry.values());
        for (PeerConnection connection : connections)
        {
            connection.requestStopReceiving();
        }
        for (PeerConnection connection : connections)
        {
            connection.stopReceiving();
        }
    }

    @Override
    public boolean isListeningForMessages()
    {
        return listeningForMessages;
    }

    @Override
    public List<String> getMessagesFrom(Peer peer)
    {
        return connection(peer).getMessages();
    }

    @Override
    public Map<Peer, List<String>> getAllMessages()
    {
        Map<Peer, List<String>> messages = new HashMap<>();
        for (Map.Entry<Peer, PeerConnection> entry : registry.entrySet())
        {
            messages.put(entry.getKey(), entry.getValue().getMessages());
        }
        return messages;
    }

    // ========== Sending ==========

    @Override
    public void sendTo(Peer peer, String message)
    {
        connection(peer).send(message);
    }

    @Override
    public BroadcastResult sendToAll(String message)
    {
        Objects.requireNonNull(message, "message");

        Set<Peer> delivered = new HashSet<>();
        Map<Peer, SendException> failures = new HashMap<>();
        for (Map.Entry<Peer, PeerConnection> entry : registry.entrySet())
        {
            try
            {
                entry.getValue().send(message);
                delivered.add(entry.getKey());
            }
            catch (SendException e)
            {
                LOG.warn("Broadcast to {} failed: {}", entry.getKey(), e.getMessage());
                failures.put(entry.getKey(), e);
            }
        }
        return new BroadcastResult(delivered, failures);
    }

    // ========== Registry ==========

    @Override
    public void dropPeer(Peer peer)
    {
        Objects.requireNonNull(peer, "peer");
        PeerConnection connection = registry.remove(peer);
        if (connection == null)
        {
            throw new UnknownPeerException(peer);
        }
        connection.close();
        LOG.info("Dropped peer {}", peer);
    }

    @Override
    public List<Peer> dropClosedPeers()
    {
        List<Peer> dropped = new ArrayList<>();
        for (Map.Entry<Peer, PeerConnection> entry : registry.entrySet())
        {
            if (entry.getValue().getState() == ConnectionState.CLOSED
                    && registry.remove(entry.getKey(), entry.getValue()))
            {
                entry.getValue().close();
                dropped.add(entry.getKey());
            }
        }
        if (!dropped.isEmpty())
        {
            LOG.info("Dropped {} closed peer(s): {}", dropped.size(), dropped);
        }
        return dropped;
    }

    @Override
    public Set<Peer> getPeers()
    {
        return Set.copyOf(registry.keySet());
    }

    @Override
    public ConnectionState getConnectionState(Peer peer)
    {
        return connection(peer).getState();
    }

    private PeerConnection connection(Peer peer)
    {
        Objects.requireNonNull(peer, "peer");
        PeerConnection connection = registry.get(peer);
        if (connection == null)
        {
            throw new UnknownPeerException(peer);
        }
        return connection;
    }

    // ========== Lifecycle ==========

    @Override
    public SocketAddress getLocalAddress()
    {
        return localAddress;
    }

    @Override
    public void close()
    {
        if (closed)
        {
            return;
        }
        closed = true;

        LOG.info("Closing stream server on {}", localAddress);

        acceptLoop.stop();
        stopListeningForMessages();

        for (PeerConnection connection : registry.values())
        {
            connection.close();
        }
        registry.clear();

        List<PendingConnection> pending = new ArrayList<>();
        pendingConnections.drainTo(pending);
        for (PendingConnection connection : pending)
        {
            connection.connection().close();
        }

        closeQuietly(acceptSelector);
        closeQuietly(serverChannel);

        LOG.info("Stream server closed");
    }

    private static void closeQuietly(AutoCloseable resource)
    {
        if (resource == null)
        {
            return;
        }
        try
        {
            resource.close();
        }
        catch (Exception e)
        {
            LOG.warn("Error closing {}", resource, e);
        }
    }
}
