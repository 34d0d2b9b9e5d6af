package org.abstractica.messaging.impl.datagram;

import org.abstractica.messaging.DatagramEndpoint;
import org.abstractica.messaging.DatagramMessage;
import org.abstractica.messaging.Peer;
import org.abstractica.messaging.errors.EndpointBindException;
import org.abstractica.messaging.errors.MessageTooLargeException;
import org.abstractica.messaging.errors.SendException;
import org.abstractica.messaging.impl.connection.InboundQueue;
import org.abstractica.messaging.impl.loop.PollingLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedSelectorException;
import java.nio.channels.DatagramChannel;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * UDP endpoint using NIO.
 *
 * <p>A single thread receives datagrams and queues them with their sender.
 * Sending is done directly from the calling thread. Each datagram carries
 * one UTF-8 message without any header.</p>
 */
public class DefaultDatagramEndpoint implements DatagramEndpoint
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultDatagramEndpoint.class);

    private final DatagramChannel channel;
    private final Selector readSelector;
    private final Selector writeSelector;
    private final Peer localPeer;
    private final int maxDatagramSize;
    private final long pollTimeoutMs;

    // One spare byte reveals datagrams above the limit
    private final ByteBuffer receiveBuffer;
    private final InboundQueue<DatagramMessage> inbound = new InboundQueue<>();
    private final PollingLoop receiveLoop;

    private volatile boolean closed;

    /**
     * Creates and binds an endpoint.
     *
     * <p>Use {@link DefaultDatagramEndpointFactory} to create instances.</p>
     *
     * @throws EndpointBindException if the address cannot be bound
     */
    DefaultDatagramEndpoint(InetSocketAddress bindAddress, int maxDatagramSize, Duration pollTimeout)
    {
        Objects.requireNonNull(bindAddress, "bindAddress");
        this.maxDatagramSize = maxDatagramSize;
        this.pollTimeoutMs = Math.max(1, pollTimeout.toMillis());
        this.receiveBuffer = ByteBuffer.allocateDirect(maxDatagramSize + 1);

        DatagramChannel opened = null;
        Selector reads = null;
        Selector writes = null;
        InetSocketAddress bound;
        try
        {
            opened = DatagramChannel.open();
            opened.configureBlocking(false);
            opened.bind(bindAddress);

            reads = Selector.open();
            writes = Selector.open();
            opened.register(reads, SelectionKey.OP_READ);
            opened.register(writes, SelectionKey.OP_WRITE);
            bound = (InetSocketAddress) opened.getLocalAddress();
        }
        catch (IOException e)
        {
            closeQuietly(reads);
            closeQuietly(writes);
            closeQuietly(opened);
            throw new EndpointBindException(bindAddress, e);
        }
        this.channel = opened;
        this.readSelector = reads;
        this.writeSelector = writes;
        this.localPeer = Peer.of(bound);

        this.receiveLoop = new PollingLoop("datagram-receive-" + localPeer, this::receiveOnce,
                e -> LOG.error("Datagram receive loop on {} failed", localPeer, e));

        LOG.info("Datagram endpoint bound to {}", localPeer);
    }

    // ========== Receiving ==========

    @Override
    public void listenForMessages()
    {
        if (closed)
        {
            throw new IllegalStateException("Endpoint is closed");
        }
        if (receiveLoop.start())
        {
            LOG.info("Listening for datagrams on {}", localPeer);
        }
    }

    @Override
    public void stopListeningForMessages()
    {
        if (receiveLoop.isRunning())
        {
            receiveLoop.stop();
            LOG.info("Stopped listening for datagrams on {}", localPeer);
        }
    }

    @Override
    public boolean isListening()
    {
        return receiveLoop.isRunning();
    }

    @Override
    public List<DatagramMessage> getMessages()
    {
        return inbound.drain();
    }

    private boolean receiveOnce()
    {
        try
        {
            if (readSelector.select(pollTimeoutMs) == 0)
            {
                return true;
            }
            readSelector.selectedKeys().clear();

            receiveBuffer.clear();
            SocketAddress source = channel.receive(receiveBuffer);
            if (source == null)
            {
                return true;
            }
            receiveBuffer.flip();

            Peer sender = Peer.of((InetSocketAddress) source);
            if (receiveBuffer.remaining() > maxDatagramSize)
            {
                LOG.warn("Dropping datagram from {} larger than {} bytes", sender, maxDatagramSize);
                return true;
            }

            byte[] payload = new byte[receiveBuffer.remaining()];
            receiveBuffer.get(payload);
            inbound.add(new DatagramMessage(new String(payload, StandardCharsets.UTF_8), sender));
            return true;
        }
        catch (IOException e)
        {
            if (!channel.isOpen())
            {
                return false;
            }
            LOG.warn("Error receiving datagram on {}: {}", localPeer, e.getMessage());
            return true;
        }
    }

    // ========== Sending ==========

    @Override
    public void send(String message, String host, int port)
    {
        Objects.requireNonNull(host, "host");
        send(message, new InetSocketAddress(host, port), new Peer(host, port));
    }

    @Override
    public void send(String message, Peer destination)
    {
        Objects.requireNonNull(destination, "destination");
        send(message, destination.toSocketAddress(), destination);
    }

    private void send(String message, InetSocketAddress address, Peer destination)
    {
        Objects.requireNonNull(message, "message");
        if (closed)
        {
            throw new IllegalStateException("Endpoint is closed");
        }

        byte[] payload = message.getBytes(StandardCharsets.UTF_8);
        if (payload.length > maxDatagramSize)
        {
            throw new MessageTooLargeException(payload.length, maxDatagramSize);
        }
        if (address.isUnresolved())
        {
            throw new SendException(destination, "cannot resolve host");
        }

        ByteBuffer datagram = ByteBuffer.wrap(payload);
        try
        {
            synchronized (writeSelector)
            {
                // A non-blocking send transmits all or nothing
                while (channel.send(datagram, address) == 0)
                {
                    writeSelector.select(pollTimeoutMs);
                    writeSelector.selectedKeys().clear();
                    if (closed)
                    {
                        throw new SendException(destination, "endpoint closed during send");
                    }
                }
            }
        }
        catch (IOException e)
        {
            throw new SendException(destination, e);
        }
        catch (ClosedSelectorException e)
        {
            throw new SendException(destination, "endpoint closed during send");
        }
    }

    // ========== Lifecycle ==========

    @Override
    public Peer getLocalPeer()
    {
        return localPeer;
    }

    @Override
    public void close()
    {
        if (receiveLoop.isRunning())
        {
            throw new IllegalStateException("Listener must be stopped first");
        }
        if (closed)
        {
            return;
        }
        closed = true;

        LOG.info("Closing datagram endpoint on {}", localPeer);

        closeQuietly(readSelector);
        closeQuietly(writeSelector);
        closeQuietly(channel);
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
