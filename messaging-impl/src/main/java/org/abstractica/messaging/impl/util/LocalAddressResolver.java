package org.abstractica.messaging.impl.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;

/**
 * Finds an address of this host that other machines can reach.
 *
 * <p>Used as the default bind address when none is configured. Resolution
 * never fails: it falls back to the host name lookup and finally to the
 * loopback address.</p>
 */
public final class LocalAddressResolver
{
    private static final Logger LOG = LoggerFactory.getLogger(LocalAddressResolver.class);

    // Connecting a datagram socket sends nothing; it only selects a route.
    private static final InetSocketAddress ROUTE_PROBE = new InetSocketAddress("8.8.8.8", 80);

    private LocalAddressResolver() {}

    /**
     * Resolves this host's usable network address.
     *
     * @return the outbound interface address, the host name address, or loopback
     */
    public static InetAddress resolve()
    {
        InetAddress routed = resolveByRoute();
        if (routed != null)
        {
            return routed;
        }

        try
        {
            InetAddress local = InetAddress.getLocalHost();
            LOG.debug("Resolved local address {} from host name", local.getHostAddress());
            return local;
        }
        catch (UnknownHostException e)
        {
            LOG.warn("Could not resolve local host name, using loopback: {}", e.getMessage());
            return InetAddress.getLoopbackAddress();
        }
    }

    /**
     * Asks the routing table which local address would reach the probe address.
     *
     * @return the local address, or null if there is no usable route
     */
    static InetAddress resolveByRoute()
    {
        try (DatagramSocket socket = new DatagramSocket())
        {
            socket.connect(ROUTE_PROBE);
            InetAddress local = socket.getLocalAddress();
            if (local == null || local.isAnyLocalAddress())
            {
                return null;
            }
            LOG.debug("Resolved local address {} by route", local.getHostAddress());
            return local;
        }
        catch (IOException | RuntimeException e)
        {
            LOG.debug("Route based address resolution failed: {}", e.getMessage());
            return null;
        }
    }
}
