package org.abstractica.messaging.errors;

import org.abstractica.messaging.Peer;

/**
 * Thrown when a message cannot be written to a peer.
 *
 * <p>A send failure concerns only the peer it names; other peers are
 * unaffected.</p>
 */
public class SendException extends MessagingException
{
    private final Peer peer;

    public SendException(Peer peer, String message)
    {
        super("Send to " + peer + " failed: " + message);
        this.peer = peer;
    }

    public SendException(Peer peer, Throwable cause)
    {
        super("Send to " + peer + " failed: " + cause.getMessage(), cause);
        this.peer = peer;
    }

    /**
     * Returns the peer the send was addressed to.
     *
     * @return the destination peer
     */
    public Peer getPeer()
    {
        return peer;
    }
}
