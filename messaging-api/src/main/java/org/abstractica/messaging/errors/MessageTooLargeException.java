package org.abstractica.messaging.errors;

/**
 * Thrown when a datagram payload exceeds the maximum datagram size.
 */
public class MessageTooLargeException extends MessagingException
{
    private final int size;
    private final int maxSize;

    public MessageTooLargeException(int size, int maxSize)
    {
        super(String.format("Message size %d exceeds maximum datagram size %d", size, maxSize));
        this.size = size;
        this.maxSize = maxSize;
    }

    public int getSize()
    {
        return size;
    }

    public int getMaxSize()
    {
        return maxSize;
    }
}
