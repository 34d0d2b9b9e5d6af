package org.abstractica.messaging;

import java.net.InetAddress;
import java.time.Duration;

/**
 * Factory for creating StreamServer instances.
 *
 * <p>Use the builder to configure the server before creation:</p>
 * <pre>{@code
 * StreamServerFactory factory = new DefaultStreamServerFactory();
 * StreamServer server = factory.builder()
 *     .port(7777)
 *     .headerWidth(4)
 *     .pollTimeout(Duration.ofMillis(50))
 *     .build();
 * }</pre>
 */
public interface StreamServerFactory
{
    /**
     * Creates a new server builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating a StreamServer.
     *
     * <p>Setters throw {@link org.abstractica.messaging.errors.ConfigurationException}
     * on invalid values.</p>
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
         * Sets the port to listen on.
         *
         * <p>Optional. Defaults to 1024. Use 0 for an ephemeral port.</p>
         *
         * @param port the port number
         * @return this builder
         */
        Builder port(int port);

        /**
         * Sets the width of the length header in bytes.
         *
         * <p>Optional. Defaults to 4. Must match the peers' setting.</p>
         *
         * @param headerWidth header width, 1 to 8
         * @return this builder
         */
        Builder headerWidth(int headerWidth);

        /**
         * Sets the readiness poll timeout of every loop.
         *
         * <p>Optional. Defaults to 100 ms. Bounds how long a stop call waits.</p>
         *
         * @param timeout the poll timeout
         * @return this builder
         */
        Builder pollTimeout(Duration timeout);

        /**
         * Sets the pending connection backlog of the listening socket.
         *
         * <p>Optional. Defaults to 50.</p>
         *
         * @param backlog the backlog size
         * @return this builder
         */
        Builder backlog(int backlog);

        /**
         * Sets the largest frame payload accepted or sent, in bytes.
         *
         * <p>Optional. Defaults to 16 MiB.</p>
         *
         * @param maxFrameSize maximum payload size
         * @return this builder
         */
        Builder maxFrameSize(int maxFrameSize);

        /**
         * Builds and binds the server.
         *
         * @return the bound server
         * @throws org.abstractica.messaging.errors.EndpointBindException if the address is unavailable
         */
        StreamServer build();
    }
}
