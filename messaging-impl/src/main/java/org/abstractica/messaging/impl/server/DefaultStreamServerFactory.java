package org.abstractica.messaging.impl.server;

import org.abstractica.messaging.StreamServer;
import org.abstractica.messaging.StreamServerFactory;
import org.abstractica.messaging.impl.framing.FrameCodec;
import org.abstractica.messaging.impl.util.ConfigChecks;
import org.abstractica.messaging.impl.util.LocalAddressResolver;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Duration;

/**
 * Default implementation of StreamServerFactory.
 *
 * <p>Creates DefaultStreamServer instances using a builder pattern.</p>
 */
public class DefaultStreamServerFactory implements StreamServerFactory
{
    public static final int DEFAULT_PORT = 1024;
    public static final int DEFAULT_BACKLOG = 50;
    public static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMillis(100);

    @Override
    public Builder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private InetAddress bindAddress;
        private int port = DEFAULT_PORT;
        private int headerWidth = FrameCodec.DEFAULT_HEADER_WIDTH;
        private Duration pollTimeout = DEFAULT_POLL_TIMEOUT;
        private int backlog = DEFAULT_BACKLOG;
        private int maxFrameSize = FrameCodec.DEFAULT_MAX_FRAME_SIZE;

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
        public Builder backlog(int backlog)
        {
            this.backlog = ConfigChecks.positive(backlog, "backlog");
            return this;
        }

        @Override
        public Builder maxFrameSize(int maxFrameSize)
        {
            this.maxFrameSize = ConfigChecks.maxFrameSize(maxFrameSize);
            return this;
        }

        @Override
        public StreamServer build()
        {
            InetAddress address = bindAddress != null ? bindAddress : LocalAddressResolver.resolve();

            return new DefaultStreamServer(
                    new InetSocketAddress(address, port),
                    backlog,
                    headerWidth,
                    maxFrameSize,
                    pollTimeout
            );
        }
    }
}
