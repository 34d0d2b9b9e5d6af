package org.abstractica.messaging.impl.connection;

import org.abstractica.messaging.ConnectionState;
import org.abstractica.messaging.Peer;
import org.abstractica.messaging.errors.ConnectionClosedException;
import org.abstractica.messaging.errors.FrameTooLargeException;
import org.abstractica.messaging.errors.SendException;
import org.abstractica.messaging.impl.framing.FrameCodec;
import org.abstractica.messaging.impl.loop.PollingLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedSelectorException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.SocketChannel;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One TCP connection to a peer, with its own receive loop and inbound queue.
 *
 * <p>The receive loop decodes frames and queues the messages; the application
 * drains them with {@link #getMessages()}. Sending is done directly from the
 * calling thread.</p>
 *
 * <p>Reads and writes wait on separate selectors, so the receive loop and a
 * sending thread never share one. Concurrent senders are serialized so frames
 * do not interleave.</p>
 */
public class PeerConnection implements AutoCloseable
{
    private static final Logger LOG = LoggerFactory.getLogger(PeerConnection.class);

    private final SocketChannel channel;
    private final Peer peer;
    private final int headerWidth;
    private final int maxFrameSize;
    private final long pollTimeoutMs;

    private final Selector readSelector;
    private final Selector writeSelector;
    private final Object sendLock = new Object();

    private final InboundQueue<String> inbound = new InboundQueue<>();
    private final PollingLoop receiveLoop;

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.IDLE);
    private final AtomicBoolean released = new AtomicBoolean(false);
    private volatile Exception failure;

    /**
     * Wraps a connected channel.
     *
     * <p>The channel is switched to non-blocking mode and owned by this
     * connection from now on.</p>
     *
     * @param channel      a connected socket channel
     * @param headerWidth  frame header width in bytes
     * @param maxFrameSize largest frame payload accepted or sent
     * @param pollTimeout  readiness wait per poll
     * @throws IOException if the channel cannot be prepared
     */
    public PeerConnection(SocketChannel channel, int headerWidth, int maxFrameSize, Duration pollTimeout)
            throws IOException
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        FrameCodec.checkHeaderWidth(headerWidth);
        if (!channel.isConnected())
        {
            throw new IllegalArgumentException("Channel is not connected");
        }

        this.headerWidth = headerWidth;
        this.maxFrameSize = maxFrameSize;
        this.pollTimeoutMs = Math.max(1, pollTimeout.toMillis());
        this.peer = Peer.of((InetSocketAddress) channel.getRemoteAddress());

        channel.configureBlocking(false);
        Selector reads = null;
        Selector writes = null;
        try
        {
            reads = Selector.open();
            writes = Selector.open();
            channel.register(reads, SelectionKey.OP_READ);
            channel.register(writes, SelectionKey.OP_WRITE);
        }
        catch (IOException e)
        {
            closeQuietly(reads);
            closeQuietly(writes);
            throw e;
        }
        this.readSelector = reads;
        this.writeSelector = writes;

        this.receiveLoop = new PollingLoop("peer-receive-" + peer, this::pollOnce, this::onLoopFailure);
        this.state.set(ConnectionState.ACTIVE);
    }

    // ========== Receiving ==========

    /**
     * Starts the receive loop unless it is already running.
     *
     * <p>Does nothing once the connection has closed.</p>
     *
     * @return true if a loop was started
     */
    public boolean startReceiving()
    {
        if (state.get() != ConnectionState.ACTIVE)
        {
            LOG.debug("Not starting receive loop for {} in state {}", peer, state.get());
            return false;
        }
        return receiveLoop.start();
    }

    /**
     * Stops the receive loop and waits for it to exit.
     *
     * <p>The connection stays open and receiving can be started again. If the
     * loop is stopped while the peer has sent only part of a frame, the stream
     * can no longer be resynchronized and the connection is closed.</p>
     */
    public void stopReceiving()
    {
        receiveLoop.stop();
    }

    /**
     * Signals the receive loop to stop without waiting for it.
     */
    public void requestStopReceiving()
    {
        receiveLoop.requestStop();
    }

    public boolean isReceiving()
    {
        return receiveLoop.isRunning();
    }

    /**
     * Drains the messages received so far.
     *
     * @return messages in arrival order, possibly empty
     */
    public List<String> getMessages()
    {
        return inbound.drain();
    }

    private boolean pollOnce() throws IOException
    {
        if (readSelector.select(pollTimeoutMs) == 0)
        {
            return true;
        }
        readSelector.selectedKeys().clear();

        String message;
        try
        {
            message = FrameCodec.decode(this::readChunk, headerWidth, maxFrameSize);
        }
        catch (ConnectionClosedException e)
        {
            LOG.info("Peer {} closed the connection", peer);
            release(null);
            return false;
        }
        catch (FrameTooLargeException e)
        {
            LOG.warn("Dropping connection to {}: {}", peer, e.getMessage());
            release(e);
            return false;
        }
        catch (InterruptedIOException e)
        {
            LOG.warn("Receive from {} stopped mid-frame, closing connection", peer);
            release(e);
            return false;
        }
        catch (IOException e)
        {
            LOG.warn("Receive from {} failed: {}", peer, e.getMessage());
            release(e);
            return false;
        }

        inbound.add(message);
        return true;
    }

    /**
     * Reads whatever is available, waiting on the read selector while nothing is.
     */
    private int readChunk(byte[] buffer, int offset, int length) throws IOException
    {
        ByteBuffer target = ByteBuffer.wrap(buffer, offset, length);
        while (true)
        {
            int read = channel.read(target);
            if (read != 0)
            {
                return read;
            }
            if (receiveLoop.isStopRequested())
            {
                throw new InterruptedIOException("Receive stopped mid-frame");
            }
            readSelector.select(pollTimeoutMs);
            readSelector.selectedKeys().clear();
        }
    }

    private void onLoopFailure(Exception e)
    {
        LOG.error("Receive loop for {} failed", peer, e);
        release(e);
    }

    // ========== Sending ==========

    /**
     * Encodes and writes one frame, looping over partial writes.
     *
     * @param message the message to send
     * @throws SendException if the connection is not active or the write fails
     * @throws org.abstractica.messaging.errors.FramingException if the message
     * cannot be framed with this connection's settings
     */
    public void send(String message)
    {
        Objects.requireNonNull(message, "message");
        ConnectionState current = state.get();
        if (current != ConnectionState.ACTIVE)
        {
            throw new SendException(peer, "connection is " + current);
        }

        ByteBuffer frame = ByteBuffer.wrap(FrameCodec.encode(message, headerWidth, maxFrameSize));
        synchronized (sendLock)
        {
            try
            {
                while (frame.hasRemaining())
                {
                    if (channel.write(frame) == 0)
                    {
                        writeSelector.select(pollTimeoutMs);
                        writeSelector.selectedKeys().clear();
                        if (state.get() != ConnectionState.ACTIVE)
                        {
                            throw new SendException(peer, "connection closed during send");
                        }
                    }
                }
            }
            catch (IOException e)
            {
                throw new SendException(peer, e);
            }
            catch (ClosedSelectorException e)
            {
                throw new SendException(peer, "connection closed during send");
            }
        }
    }

    // ========== Lifecycle ==========

    /**
     * Stops receiving and releases the socket.
     */
    @Override
    public void close()
    {
        if (state.compareAndSet(ConnectionState.ACTIVE, ConnectionState.CLOSING))
        {
            LOG.debug("Closing connection to {}", peer);
        }
        receiveLoop.stop();
        release(null);
    }

    /**
     * Marks the connection closed and releases the channel and selectors.
     */
    private void release(Exception cause)
    {
        if (cause != null && failure == null)
        {
            failure = cause;
        }
        state.set(ConnectionState.CLOSED);

        if (!released.compareAndSet(false, true))
        {
            return;
        }
        try
        {
            channel.close();
        }
        catch (IOException e)
        {
            LOG.warn("Error closing channel to {}", peer, e);
        }
        closeQuietly(readSelector);
        closeQuietly(writeSelector);
    }

    private static void closeQuietly(Selector selector)
    {
        if (selector == null)
        {
            return;
        }
        try
        {
            selector.close();
        }
        catch (IOException e)
        {
            LOG.warn("Error closing selector", e);
        }
    }

    // ========== Accessors ==========

    public Peer getPeer()
    {
        return peer;
    }

    public ConnectionState getState()
    {
        return state.get();
    }

    /**
     * Returns the error that ended the connection, if any.
     *
     * @return the failure, or empty for a clean close
     */
    public Optional<Exception> getFailure()
    {
        return Optional.ofNullable(failure);
    }

    /**
     * Returns the local address of the connection.
     *
     * @return the local socket address, or null once closed
     */
    public SocketAddress getLocalAddress()
    {
        try
        {
            return channel.getLocalAddress();
        }
        catch (IOException e)
        {
            return null;
        }
    }

    @Override
    public String toString()
    {
        return "PeerConnection[" + peer + ", " + state.get() + "]";
    }
}
