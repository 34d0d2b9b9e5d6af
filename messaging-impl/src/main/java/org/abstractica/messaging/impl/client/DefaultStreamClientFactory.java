package org.abstractica.messaging.impl.client;

import org.abstractica.messaging.StreamClient;
import org.abstractica.messaging.StreamClientFactory;
import org.abstractica.messaging.errors.ConfigurationException;
import org.abstractica.messaging.impl.framing.FrameCodec;
import org.abstractica.messaging.impl.util.ConfigChecks;

import java.net.InetSocketAddress;
import java.time.Duration;

/**
 * Default implementation of StreamClientFactory.
 *
 * <p>Creates DefaultStreamClient instances using a builder pattern.</p>
 */
public class DefaultStreamClientFactory implements StreamClientFactory
{
    public static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMillis(100);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);

    @Override
    public Builder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private String host;
        private int port;
        private int headerWidth = FrameCodec.DEFAULT_HEADER_WIDTH;
        private Duration pollTimeout = DEFAULT_POLL_TIMEOUT;
        private int maxFrameSize = FrameCodec.DEFAULT_MAX_FRAME_SIZE;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;

        @Override
        public Builder serverAddress(String host, int port)
        {
            if (host == null || host.isBlank())
            {
                throw new ConfigurationException("Server host must not be blank");
            }
            this.host = host;
            this.port = ConfigChecks.remotePort(port);
            return this;
        }

        @Override
        public Builder headerWidth(int headerWidth)
        {
            this.headerWidth = ConfigChecks.headerWidth(headerWidth);
            return this;
        }

        @Override
        public Builder pollTimeout(Duration timeout)
        {
            this.pollTimeout = ConfigChecks.timeout(timeout, "pollTimeout");
            return this;
        }

        @Override
        public Builder maxFrameSize(int maxFrameSize)
        {
            this.maxFrameSize = ConfigChecks.maxFrameSize(maxFrameSize);
            return this;
        }

        @Override
        public Builder connectTimeout(Duration timeout)
        {
            this.connectTimeout = ConfigChecks.timeout(timeout, "connectTimeout");
            return this;
        }

        @Override
        public StreamClient build()
        {
            if (host == null)
            {
                throw new ConfigurationException("Server address must be specified");
            }

            InetSocketAddress serverAddress = new InetSocketAddress(host, port);
            if (serverAddress.isUnresolved())
            {
                throw new ConfigurationException("Cannot resolve server host: " + host);
            }

            return new DefaultStreamClient(
                    serverAddress,
                    headerWidth,
                    maxFrameSize,
                    pollTimeout,
                    connectTimeout
            );
        }
    }
}
