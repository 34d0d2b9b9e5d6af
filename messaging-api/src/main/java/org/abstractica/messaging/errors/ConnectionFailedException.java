package org.abstractica.messaging.errors;

import org.abstractica.messaging.Peer;

/**
 * Thrown when a client cannot establish its connection to the server.
 */
public class ConnectionFailedException extends MessagingException
{
    private final Peer server;

    public ConnectionFailedException(Peer server, Throwable cause)
    {
        super("Failed to connect to " + server + ": " + cause.getMessage(), cause);
        this.server = server;
    }

    public Peer getServer()
    {
        return server;
    }
}
