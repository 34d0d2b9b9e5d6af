package org.abstractica.messaging.impl.framing;

import org.abstractica.messaging.errors.ConnectionClosedException;
import org.abstractica.messaging.errors.FrameTooLargeException;
import org.abstractica.messaging.errors.FramingException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Encodes and decodes length-prefixed text frames.
 *
 * <p>Frame format: a header of {@code headerWidth} bytes holding the payload
 * length as a big-endian unsigned integer, followed by the UTF-8 payload.</p>
 *
 * <pre>
 * +---------------------------+---------------------------+
 * | length (headerWidth, BE)  | payload (length bytes)    |
 * +---------------------------+---------------------------+
 * </pre>
 *
 * <p>The header width is not negotiated; both sides must be configured alike.</p>
 */
public final class FrameCodec
{
    /**
     * Default header width: a 32-bit length.
     */
    public static final int DEFAULT_HEADER_WIDTH = 4;

    /**
     * Widest supported header: a 64-bit length.
     */
    public static final int MAX_HEADER_WIDTH = 8;

    /**
     * Default ceiling on a frame payload: 16 MiB.
     */
    public static final int DEFAULT_MAX_FRAME_SIZE = 16 * 1024 * 1024;

    /**
     * Largest ceiling that still fits a Java array.
     */
    public static final int MAX_FRAME_SIZE_LIMIT = Integer.MAX_VALUE - 8;

    private FrameCodec() {}

    // ========== Encoding ==========

    /**
     * Encodes a message into a frame.
     *
     * @param message     the message to encode
     * @param headerWidth header width in bytes, 1 to 8
     * @return header followed by the UTF-8 payload
     * @throws FramingException if the payload length does not fit in the header
     */
    public static byte[] encode(String message, int headerWidth)
    {
        return encode(message, headerWidth, MAX_FRAME_SIZE_LIMIT);
    }

    /**
     * Encodes a message into a frame, enforcing a payload ceiling.
     *
     * @param message      the message to encode
     * @param headerWidth  header width in bytes, 1 to 8
     * @param maxFrameSize largest payload allowed
     * @return header followed by the UTF-8 payload
     * @throws FrameTooLargeException if the payload exceeds {@code maxFrameSize}
     * @throws FramingException       if the payload length does not fit in the header
     */
    public static byte[] encode(String message, int headerWidth, int maxFrameSize)
    {
        Objects.requireNonNull(message, "message");
        checkHeaderWidth(headerWidth);

        byte[] payload = message.getBytes(StandardCharsets.UTF_8);
        if (payload.length > maxFrameSize)
        {
            throw new FrameTooLargeException(payload.length, maxFrameSize);
        }
        if (!fitsInHeader(payload.length, headerWidth))
        {
            throw new FramingException(String.format(
                    "Payload of %d bytes does not fit in a %d-byte length header",
                    payload.length, headerWidth));
        }

        byte[] frame = new byte[headerWidth + payload.length];
        writeLength(payload.length, frame, headerWidth);
        System.arraycopy(payload, 0, frame, headerWidth, payload.length);
        return frame;
    }

    // ========== Decoding ==========

    /**
     * Decodes one frame using the default ceiling.
     *
     * @param reader      source of frame bytes
     * @param headerWidth header width in bytes, 1 to 8
     * @return the decoded message
     * @throws IOException on transport failure
     */
    public static String decode(ChunkReader reader, int headerWidth) throws IOException
    {
        return decode(reader, headerWidth, DEFAULT_MAX_FRAME_SIZE);
    }

    /**
     * Decodes one frame.
     *
     * <p>Reads exactly the header, then exactly the announced payload, looping
     * over short reads until each count is satisfied.</p>
     *
     * @param reader       source of frame bytes
     * @param headerWidth  header width in bytes, 1 to 8
     * @param maxFrameSize largest payload accepted
     * @return the decoded message
     * @throws ConnectionClosedException if the source ends before the frame is complete
     * @throws FrameTooLargeException    if the announced length exceeds {@code maxFrameSize}
     * @throws IOException               on transport failure
     */
    public static String decode(ChunkReader reader, int headerWidth, int maxFrameSize) throws IOException
    {
        Objects.requireNonNull(reader, "reader");
        checkHeaderWidth(headerWidth);

        byte[] header = new byte[headerWidth];
        int headerRead = readFully(reader, header);
        if (headerRead == 0)
        {
            throw new ConnectionClosedException("Stream closed before frame header");
        }
        if (headerRead < headerWidth)
        {
            throw new ConnectionClosedException(String.format(
                    "Stream closed after %d of %d header bytes", headerRead, headerWidth));
        }

        long length = readLength(header, headerWidth);
        if (Long.compareUnsigned(length, maxFrameSize) > 0)
        {
            throw new FrameTooLargeException(length, maxFrameSize);
        }

        byte[] payload = new byte[(int) length];
        int payloadRead = readFully(reader, payload);
        if (payloadRead < payload.length)
        {
            throw new ConnectionClosedException(String.format(
                    "Stream closed after %d of %d payload bytes", payloadRead, payload.length));
        }
        return new String(payload, StandardCharsets.UTF_8);
    }

    // ========== Header ==========

    /**
     * Reads a big-endian unsigned length from a header.
     *
     * @param header      the header bytes
     * @param headerWidth number of leading bytes that form the header
     * @return the length; for an 8-byte header, interpret as unsigned
     */
    public static long readLength(byte[] header, int headerWidth)
    {
        checkHeaderWidth(headerWidth);
        long length = 0;
        for (int i = 0; i < headerWidth; i++)
        {
            length = (length << 8) | (header[i] & 0xFF);
        }
        return length;
    }

    /**
     * Returns whether a payload length fits in a header of the given width.
     *
     * @param length      payload length in bytes
     * @param headerWidth header width in bytes
     * @return true if {@code length < 2^(8 * headerWidth)}
     */
    public static boolean fitsInHeader(long length, int headerWidth)
    {
        if (length < 0)
        {
            return false;
        }
        return headerWidth >= MAX_HEADER_WIDTH || length < (1L << (8 * headerWidth));
    }

    /**
     * Validates a header width.
     *
     * @param headerWidth the width to check
     * @throws IllegalArgumentException if outside 1 to 8
     */
    public static void checkHeaderWidth(int headerWidth)
    {
        if (headerWidth < 1 || headerWidth > MAX_HEADER_WIDTH)
        {
            throw new IllegalArgumentException(
                    "headerWidth must be 1-" + MAX_HEADER_WIDTH + ": " + headerWidth);
        }
    }

    private static void writeLength(long length, byte[] frame, int headerWidth)
    {
        for (int i = headerWidth - 1; i >= 0; i--)
        {
            frame[i] = (byte) length;
            length >>>= 8;
        }
    }

    /**
     * Fills the buffer, returning fewer bytes only when the source ends.
     */
    private static int readFully(ChunkReader reader, byte[] buffer) throws IOException
    {
        int offset = 0;
        while (offset < buffer.length)
        {
            int read = reader.read(buffer, offset, buffer.length - offset);
            if (read <= 0)
            {
                return offset;
            }
            offset += read;
        }
        return offset;
    }
}
