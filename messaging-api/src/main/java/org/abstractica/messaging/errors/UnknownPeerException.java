package org.abstractica.messaging.errors;

import org.abstractica.messaging.Peer;

/**
 * Thrown when an operation names a peer that is not in the server registry.
 */
public class UnknownPeerException extends MessagingException
{
    private final Peer peer;

    public UnknownPeerException(Peer peer)
    {
        super("Unknown peer: " + peer);
        this.peer = peer;
    }

    public Peer getPeer()
    {
        return peer;
    }
}
