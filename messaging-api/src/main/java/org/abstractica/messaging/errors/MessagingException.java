package org.abstractica.messaging.errors;

/**
 * Base class for failures raised by the messaging library.
 */
public class MessagingException extends RuntimeException
{
    public MessagingException(String message)
    {
        super(message);
    }

    public MessagingException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
