package org.abstractica.messaging.errors;

/**
 * Thrown when a message cannot be framed or a frame cannot be decoded.
 *
 * <p>A connection that raised this while decoding should be closed, since
 * the position in the byte stream can no longer be trusted.</p>
 */
public class FramingException extends MessagingException
{
    public FramingException(String message)
    {
        super(message);
    }

    public FramingException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
