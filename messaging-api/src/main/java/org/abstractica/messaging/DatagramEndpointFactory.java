package org.abstractica.messaging;

import java.net.InetAddress;
import java.time.Duration;

/**
 * Factory for creating DatagramEndpoint instances.
 */
public interface DatagramEndpointFactory
{
    /**
     * Creates a new endpoint builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating a DatagramEndpoint.
     */
    interface Builder
    {
        /**
         * Sets the address to bind to.
         *
         * <p>Optional. Defaults to this host's resolved network address.</p>
         *
         * @param address the bind address
         * @return this builder
         */
        Builder bindAddress(InetAddress address);

        /**
         * Sets the port to bind to.
         *
         * <p>Optional. Defaults to 1024. Use 0 for an ephemeral port.</p>
         *
         * @param port the port number
         * @return this builder
         */
        Builder port(int port);

        /**
         * Sets the readiness poll timeout of the receive loop.
         *
         * <p>Optional. Defaults to 100 ms.</p>
         *
         * @param timeout the poll timeout
         * @return this builder
         */
        Builder pollTimeout(Duration timeout);

        /**
         * Sets the largest payload sent or accepted, in bytes.
         *
         * <p>Optional. Defaults to 65507, the IPv4 UDP limit.</p>
         *
         * @param maxDatagramSize maximum payload size
         * @return this builder
         */
        Builder maxDatagramSize(int maxDatagramSize);

        /**
         * Builds and binds the endpoint.
         *
         * @return the bound endpoint
         * @throws org.abstractica.messaging.errors.EndpointBindException if the address is unavailable
         */
        DatagramEndpoint build();
    }
}
