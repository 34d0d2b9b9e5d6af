package org.abstractica.messaging;

import java.util.List;

/**
 * A bound UDP socket exchanging one text message per datagram.
 *
 * <p>Datagrams carry their own boundaries, so no length header is used. Each
 * received message is tagged with its sender.</p>
 */
public interface DatagramEndpoint extends AutoCloseable
{
    /**
     * Starts the receive loop. Does nothing if it is already running.
     */
    void listenForMessages();

    /**
     * Stops the receive loop and waits for it to exit.
     */
    void stopListeningForMessages();

    /**
     * Drains the messages received so far.
     *
     * @return messages with their senders, in arrival order
     */
    List<DatagramMessage> getMessages();

    /**
     * Sends a message as a single datagram.
     *
     * @param message the message to send
     * @param host    destination host name or address
     * @param port    destination port
     * @throws org.abstractica.messaging.errors.MessageTooLargeException if the encoded
     * message exceeds the maximum datagram size
     * @throws org.abstractica.messaging.errors.SendException if the datagram cannot be sent
     */
    void send(String message, String host, int port);

    /**
     * Sends a message as a single datagram.
     *
     * @param message     the message to send
     * @param destination the destination peer
     */
    void send(String message, Peer destination);

    /**
     * Returns whether the receive loop is running.
     *
     * @return true while listening
     */
    boolean isListening();

    /**
     * Returns the address this endpoint is bound to.
     *
     * @return the local peer
     */
    Peer getLocalPeer();

    /**
     * Releases the socket.
     *
     * @throws IllegalStateException if the receive loop is still running
     */
    @Override
    void close();
}
