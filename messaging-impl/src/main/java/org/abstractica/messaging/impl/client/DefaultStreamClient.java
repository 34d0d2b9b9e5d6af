package org.abstractica.messaging.impl.client;

import org.abstractica.messaging.ConnectionState;
import org.abstractica.messaging.Peer;
import org.abstractica.messaging.StreamClient;
import org.abstractica.messaging.errors.ConnectionFailedException;
import org.abstractica.messaging.impl.connection.PeerConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.channels.SocketChannel;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Default implementation of the StreamClient interface.
 *
 * <p>Wraps a single {@link PeerConnection} created by {@link #connect()}.</p>
 */
public class DefaultStreamClient implements StreamClient
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultStreamClient.class);

    private final InetSocketAddress serverAddress;
    private final Peer server;
    private final int headerWidth;
    private final int maxFrameSize;
    private final Duration pollTimeout;
    private final Duration connectTimeout;

    private volatile PeerConnection connection;
    private volatile boolean closed;

    /**
     * Creates an unconnected client.
     *
     * <p>Use {@link DefaultStreamClientFactory} to create instances.</p>
     */
    DefaultStreamClient(
            InetSocketAddress serverAddress,
            int headerWidth,
            int maxFrameSize,
            Duration pollTimeout,
            Duration connectTimeout
    )
    {
        this.serverAddress = Objects.requireNonNull(serverAddress, "serverAddress");
        this.server = Peer.of(serverAddress);
        this.headerWidth = headerWidth;
        this.maxFrameSize = maxFrameSize;
        this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    }

    @Override
    public synchronized void connect()
    {
        if (closed)
        {
            throw new IllegalStateException("Client is closed");
        }
        if (connection != null)
        {
            throw new IllegalStateException("Already connected to " + server);
        }

        LOG.info("Connecting to {}", server);

        SocketChannel channel = null;
        try
        {
            channel = SocketChannel.open();
            int timeoutMs = (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis());
            channel.socket().connect(serverAddress, timeoutMs);
            connection = new PeerConnection(channel, headerWidth, maxFrameSize, pollTimeout);
        }
        catch (IOException e)
        {
            if (channel != null)
            {
                try
                {
                    channel.close();
                }
                catch (IOException closeError)
                {
                    e.addSuppressed(closeError);
                }
            }
            throw new ConnectionFailedException(server, e);
        }

        LOG.info("Connected to {} from {}", server, connection.getLocalAddress());
    }

    @Override
    public void startReceiving()
    {
        requireConnection().startReceiving();
    }

    @Override
    public void stopReceiving()
    {
        PeerConnection current = connection;
        if (current != null)
        {
            current.stopReceiving();
        }
    }

    @Override
    public void send(String message)
    {
        requireConnection().send(message);
    }

    @Override
    public List<String> getMessages()
    {
        PeerConnection current = connection;
        return current != null ? current.getMessages() : List.of();
    }

    @Override
    public boolean isReceiving()
    {
        PeerConnection current = connection;
        return current != null && current.isReceiving();
    }

    @Override
    public ConnectionState getState()
    {
        PeerConnection current = connection;
        if (current == null)
        {
            return closed ? ConnectionState.CLOSED : ConnectionState.IDLE;
        }
        return current.getState();
    }

    @Override
    public Peer getServer()
    {
        return server;
    }

    @Override
    public SocketAddress getLocalAddress()
    {
        PeerConnection current = connection;
        return current != null ? current.getLocalAddress() : null;
    }

    @Override
    public synchronized void close()
    {
        if (closed)
        {
            return;
        }
        closed = true;

        if (connection != null)
        {
            LOG.info("Closing connection to {}", server);
            connection.close();
        }
    }

    private PeerConnection requireConnection()
    {
        PeerConnection current = connection;
        if (current == null)
        {
            throw new IllegalStateException("Client is not connected");
        }
        return current;
    }
}
