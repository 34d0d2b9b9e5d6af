package org.abstractica.messaging;

import java.net.SocketAddress;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A TCP server that accepts peers and exchanges length-prefixed messages with them.
 *
 * <p>Accepting connections and receiving messages run on background threads;
 * everything else runs on the caller's thread. Newly accepted peers wait in a
 * pending queue until {@link #drainNewConnections()} admits them to the
 * registry.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * StreamServer server = serverFactory.builder()
 *     .bindAddress(InetAddress.getLoopbackAddress())
 *     .port(7777)
 *     .build();
 *
 * server.listenForConnections();
 * server.listenForMessages();
 *
 * // application loop
 * for (Peer peer : server.drainNewConnections())
 * {
 *     server.sendTo(peer, "welcome");
 * }
 * server.getAllMessages().forEach((peer, messages) -> ...);
 * }</pre>
 */
public interface StreamServer extends AutoCloseable
{
    /**
     * Starts the accept loop. Does nothing if it is already running.
     */
    void listenForConnections();

    /**
     * Stops the accept loop and waits for it to exit.
     *
     * <p>Already accepted peers are unaffected.</p>
     */
    void stopListeningForConnections();

    /**
     * Admits every pending connection into the registry.
     *
     * @return the newly admitted peers, in acceptance order
     */
    List<Peer> drainNewConnections();

    /**
     * Starts a receive loop for every registered peer that lacks one.
     *
     * <p>Safe to call repeatedly; running loops are never restarted. While in
     * effect, peers admitted later by {@link #drainNewConnections()} start
     * receiving as well.</p>
     */
    void listenForMessages();

    /**
     * Stops every peer's receive loop and waits for all of them to exit.
     */
    void stopListeningForMessages();

    /**
     * Drains the messages received from one peer.
     *
     * @param peer the registered peer
     * @return messages in arrival order, possibly empty
     * @throws org.abstractica.messaging.errors.UnknownPeerException if the peer is not registered
     */
    List<String> getMessagesFrom(Peer peer);

    /**
     * Drains the messages received from every registered peer.
     *
     * @return mapping of every registered peer to its messages; peers without
     * messages map to an empty list
     */
    Map<Peer, List<String>> getAllMessages();

    /**
     * Sends a message to one peer.
     *
     * @param peer    the registered peer
     * @param message the message to send
     * @throws org.abstractica.messaging.errors.UnknownPeerException if the peer is not registered
     * @throws org.abstractica.messaging.errors.SendException if the write fails
     */
    void sendTo(Peer peer, String message);

    /**
     * Sends a message to every registered peer.
     *
     * <p>A failure on one peer does not prevent attempts on the others.</p>
     *
     * @param message the message to send
     * @return which peers received the message and which failed
     */
    BroadcastResult sendToAll(String message);

    /**
     * Stops the peer's receive loop, closes its socket and forgets it.
     *
     * @param peer the registered peer
     * @throws org.abstractica.messaging.errors.UnknownPeerException if the peer is not registered
     */
    void dropPeer(Peer peer);

    /**
     * Drops every registered peer whose connection has closed.
     *
     * @return the peers that were dropped
     */
    List<Peer> dropClosedPeers();

    /**
     * Returns the registered peers.
     *
     * @return unmodifiable snapshot of the registry keys
     */
    Set<Peer> getPeers();

    /**
     * Returns the state of a registered peer's connection.
     *
     * @param peer the registered peer
     * @return the connection state
     * @throws org.abstractica.messaging.errors.UnknownPeerException if the peer is not registered
     */
    ConnectionState getConnectionState(Peer peer);

    /**
     * Returns whether the accept loop is running.
     *
     * @return true while listening for connections
     */
    boolean isListeningForConnections();

    /**
     * Returns whether {@link #listenForMessages()} is in effect.
     *
     * @return true while listening for messages
     */
    boolean isListeningForMessages();

    /**
     * Returns the address the listening socket is bound to.
     *
     * @return the local socket address
     */
    SocketAddress getLocalAddress();

    /**
     * Stops all loops and closes every connection and the listening socket.
     */
    @Override
    void close();
}
