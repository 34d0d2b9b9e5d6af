package org.abstractica.messaging.impl.framing;

import java.io.IOException;

/**
 * A source of bytes that may deliver fewer bytes than requested.
 *
 * <p>Stream sockets are allowed to return short reads, so callers needing an
 * exact count must call repeatedly.</p>
 */
@FunctionalInterface
public interface ChunkReader
{
    /**
     * Reads up to {@code length} bytes into {@code buffer}.
     *
     * @param buffer the destination
     * @param offset first index to write
     * @param length maximum number of bytes to read, at least 1
     * @return the number of bytes read, or zero or less once the source has ended
     * @throws IOException on transport failure
     */
    int read(byte[] buffer, int offset, int length) throws IOException;
}
