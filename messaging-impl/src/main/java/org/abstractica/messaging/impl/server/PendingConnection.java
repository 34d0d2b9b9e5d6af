package org.abstractica.messaging.impl.server;

import org.abstractica.messaging.Peer;
import org.abstractica.messaging.impl.connection.PeerConnection;

/**
 * A connection accepted by the accept loop but not yet admitted to the registry.
 *
 * @param connection the accepted connection, owned by whoever holds this record
 * @param peer       the remote address of the connection
 */
record PendingConnection(PeerConnection connection, Peer peer)
{
}
