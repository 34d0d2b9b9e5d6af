package org.abstractica.messaging.errors;

import java.net.SocketAddress;

/**
 * Thrown when a server or datagram endpoint cannot bind its local address.
 */
public class EndpointBindException extends MessagingException
{
    private final SocketAddress address;

    public EndpointBindException(SocketAddress address, Throwable cause)
    {
        super("Failed to bind " + address + ": " + cause.getMessage(), cause);
        this.address = address;
    }

    /**
     * Returns the address that could not be bound.
     *
     * @return the requested bind address
     */
    public SocketAddress getAddress()
    {
        return address;
    }
}
