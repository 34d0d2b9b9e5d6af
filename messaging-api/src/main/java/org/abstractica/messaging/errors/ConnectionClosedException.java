package org.abstractica.messaging.errors;

/**
 * Thrown when the remote side closes a stream before a frame is complete.
 *
 * <p>Receive loops treat this as the normal end of a connection rather than
 * a crash.</p>
 */
public class ConnectionClosedException extends MessagingException
{
    public ConnectionClosedException(String message)
    {
        super(message);
    }
}
