package org.abstractica.messaging.impl.util;

import org.abstractica.messaging.errors.ConfigurationException;
import org.abstractica.messaging.impl.framing.FrameCodec;

import java.net.InetAddress;
import java.time.Duration;

/**
 * Validation shared by the builders.
 *
 * <p>Every check throws {@link ConfigurationException} and otherwise returns
 * its argument.</p>
 */
public final class ConfigChecks
{
    private ConfigChecks() {}

    public static int bindPort(int port)
    {
        if (port < 0 || port > 65535)
        {
            throw new ConfigurationException("Port must be 0-65535: " + port);
        }
        return port;
    }

    public static int remotePort(int port)
    {
        if (port < 1 || port > 65535)
        {
            throw new ConfigurationException("Port must be 1-65535: " + port);
        }
        return port;
    }

    public static int headerWidth(int headerWidth)
    {
        if (headerWidth < 1 || headerWidth > FrameCodec.MAX_HEADER_WIDTH)
        {
            throw new ConfigurationException(
                    "headerWidth must be 1-" + FrameCodec.MAX_HEADER_WIDTH + ": " + headerWidth);
        }
        return headerWidth;
    }

    public static int maxFrameSize(int maxFrameSize)
    {
        if (maxFrameSize <= 0 || maxFrameSize > FrameCodec.MAX_FRAME_SIZE_LIMIT)
        {
            throw new ConfigurationException(
                    "maxFrameSize must be 1-" + FrameCodec.MAX_FRAME_SIZE_LIMIT + ": " + maxFrameSize);
        }
        return maxFrameSize;
    }

    /**
     * Requires a timeout of at least one millisecond.
     */
    public static Duration timeout(Duration timeout, String name)
    {
        if (timeout == null)
        {
            throw new ConfigurationException(name + " must not be null");
        }
        if (timeout.toMillis() < 1)
        {
            throw new ConfigurationException(name + " must be at least 1 ms: " + timeout);
        }
        return timeout;
    }

    public static int positive(int value, String name)
    {
        if (value <= 0)
        {
            throw new ConfigurationException(name + " must be positive: " + value);
        }
        return value;
    }

    /**
     * Requires a unicast address a socket can bind to.
     */
    public static InetAddress bindAddress(InetAddress address)
    {
        if (address == null)
        {
            throw new ConfigurationException("bindAddress must not be null");
        }
        if (address.isMulticastAddress())
        {
            throw new ConfigurationException("Cannot bind to multicast address " + address.getHostAddress());
        }
        return address;
    }
}
