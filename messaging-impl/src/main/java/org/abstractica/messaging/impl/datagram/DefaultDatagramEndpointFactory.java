package org.abstractica.messaging.impl.datagram;

import org.abstractica.messaging.DatagramEndpoint;
import org.abstractica.messaging.DatagramEndpointFactory;
import org.abstractica.messaging.errors.ConfigurationException;
import org.abstractica.messaging.impl.util.ConfigChecks;
import org.abstractica.messaging.impl.util.LocalAddressResolver;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Duration;

/**
 * Default implementation of DatagramEndpointFactory.
 *
 * <p>Creates DefaultDatagramEndpoint instances using a builder pattern.</p>
 */
public class DefaultDatagramEndpointFactory implements DatagramEndpointFactory
{
    public static final int DEFAULT_PORT = 1024;
    public static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMillis(100);

    /**
     * Largest UDP payload over IPv4: 65535 - 8 byte UDP header - 20 byte IP header.
     */
    public static final int MAX_DATAGRAM_SIZE = 65507;

    @Override
    public Builder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private InetAddress bindAddress;
        private int port = DEFAULT_PORT;
        private Duration pollTimeout = DEFAULT_POLL_TIMEOUT;
        private int maxDatagramSize = MAX_DATAGRAM_SIZE;

        @Override
        public Builder bindAddress(InetAddress address)
        {
            this.bindAddress = ConfigChecks.bindAddress(address);
            return this;
        }

        @Override
        public Builder port(int port)
        {
            this.port = ConfigChecks.bindPort(port);
            return this;
        }

        @Override
        public Builder pollTimeout(Duration timeout)
        {
            this.pollTimeout = ConfigChecks.timeout(timeout, "pollTimeout");
            return this;
        }

        @Override
        public Builder maxDatagramSize(int maxDatagramSize)
        {
            if (maxDatagramSize < 1 || maxDatagramSize > MAX_DATAGRAM_SIZE)
            {
                throw new ConfigurationException(
                        "maxDatagramSize must be 1-" + MAX_DATAGRAM_SIZE + ": " + maxDatagramSize);
            }
            this.maxDatagramSize = maxDatagramSize;
            return this;
        }

        @Override
        public DatagramEndpoint build()
        {
            InetAddress address = bindAddress != null ? bindAddress : LocalAddressResolver.resolve();
            return new DefaultDatagramEndpoint(new InetSocketAddress(address, port), maxDatagramSize, pollTimeout);
        }
    }
}
