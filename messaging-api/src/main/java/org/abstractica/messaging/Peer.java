package org.abstractica.messaging;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * A remote or local network address identified by host and port.
 *
 * <p>The host is the textual IP address, so two connections from the same
 * machine on different ports are distinct peers.</p>
 *
 * @param host the IP address in textual form
 * @param port the port number
 */
public record Peer(String host, int port)
{
    public Peer
    {
        Objects.requireNonNull(host, "host");
        if (port < 0 || port > 65535)
        {
            throw new IllegalArgumentException("Port must be 0-65535: " + port);
        }
    }

    /**
     * Creates a peer from a resolved socket address.
     *
     * @param address the socket address
     * @return the peer
     */
    public static Peer of(InetSocketAddress address)
    {
        Objects.requireNonNull(address, "address");
        String host = address.getAddress() != null
                ? address.getAddress().getHostAddress()
                : address.getHostString();
        return new Peer(host, address.getPort());
    }

    /**
     * Returns this peer as a socket address.
     *
     * @return a socket address for host and port
     */
    public InetSocketAddress toSocketAddress()
    {
        return new InetSocketAddress(host, port);
    }

    @Override
    public String toString()
    {
        return host.indexOf(':') >= 0
                ? "[" + host + "]:" + port
                : host + ":" + port;
    }
}
