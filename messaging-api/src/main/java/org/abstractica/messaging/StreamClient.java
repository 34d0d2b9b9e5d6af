package org.abstractica.messaging;

import java.net.SocketAddress;
import java.util.List;

/**
 * A single outbound TCP connection exchanging length-prefixed messages.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * StreamClient client = clientFactory.builder()
 *     .serverAddress("chat.example.com", 7777)
 *     .build();
 *
 * client.connect();
 * client.startReceiving();
 * client.send("hello");
 * List<String> replies = client.getMessages();
 * }</pre>
 */
public interface StreamClient extends AutoCloseable
{
    /**
     * Connects to the server.
     *
     * @throws org.abstractica.messaging.errors.ConnectionFailedException if the server cannot be reached
     * @throws IllegalStateException if already connected or closed
     */
    void connect();

    /**
     * Starts the receive loop. Does nothing if it is already running or the
     * connection has closed.
     *
     * @throws IllegalStateException if not yet connected
     */
    void startReceiving();

    /**
     * Stops the receive loop and waits for it to exit. Does nothing if no loop
     * is running.
     */
    void stopReceiving();

    /**
     * Sends a message to the server.
     *
     * @param message the message to send
     * @throws org.abstractica.messaging.errors.SendException if the write fails
     * @throws IllegalStateException if not yet connected
     */
    void send(String message);

    /**
     * Drains the messages received so far.
     *
     * @return messages in arrival order, possibly empty
     */
    List<String> getMessages();

    /**
     * Returns whether the receive loop is running.
     *
     * @return true while receiving
     */
    boolean isReceiving();

    /**
     * Returns the connection state.
     *
     * @return {@link ConnectionState#IDLE} before {@link #connect()}, then the
     * state of the connection
     */
    ConnectionState getState();

    /**
     * Returns the server this client connects to.
     *
     * @return the server address
     */
    Peer getServer();

    /**
     * Returns the local address of the connection.
     *
     * @return the local socket address, or null if not connected
     */
    SocketAddress getLocalAddress();

    /**
     * Stops receiving and closes the connection.
     */
    @Override
    void close();
}
