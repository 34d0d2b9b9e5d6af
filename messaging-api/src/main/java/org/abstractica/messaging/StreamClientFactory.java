package org.abstractica.messaging;

import java.time.Duration;

/**
 * Factory for creating StreamClient instances.
 *
 * <pre>{@code
 * StreamClient client = new DefaultStreamClientFactory().builder()
 *     .serverAddress("chat.example.com", 7777)
 *     .build();
 * }</pre>
 */
public interface StreamClientFactory
{
    /**
     * Creates a new client builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating a StreamClient.
     */
    interface Builder
    {
        /**
         * Sets the server address to connect to.
         *
         * @param host the server hostname or IP address
         * @param port the server port
         * @return this builder
         */
        Builder serverAddress(String host, int port);

        /**
         * Sets the width of the length header in bytes.
         *
         * <p>Optional. Defaults to 4.</p>
         *
         * @param headerWidth header width, 1 to 8
         * @return this builder
         */
        Builder headerWidth(int headerWidth);

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
         * Sets the largest frame payload accepted or sent, in bytes.
         *
         * <p>Optional. Defaults to 16 MiB.</p>
         *
         * @param maxFrameSize maximum payload size
         * @return this builder
         */
        Builder maxFrameSize(int maxFrameSize);

        /**
         * Sets how long {@link StreamClient#connect()} may take.
         *
         * <p>Optional. Defaults to 5 seconds.</p>
         *
         * @param timeout the connect timeout
         * @return this builder
         */
        Builder connectTimeout(Duration timeout);

        /**
         * Builds the client. The client is not connected yet.
         *
         * @return the configured client
         * @throws org.abstractica.messaging.errors.ConfigurationException if the server
         * address is missing or cannot be resolved
         */
        StreamClient build();
    }
}
