package org.abstractica.messaging.errors;

/**
 * Thrown when a frame length exceeds the configured safety ceiling.
 */
public class FrameTooLargeException extends FramingException
{
    private final long length;
    private final int maxFrameSize;

    public FrameTooLargeException(long length, int maxFrameSize)
    {
        super(String.format("Frame length %s exceeds maximum allowed size %d",
                Long.toUnsignedString(length), maxFrameSize));
        this.length = length;
        this.maxFrameSize = maxFrameSize;
    }

    /**
     * Returns the offending length, as an unsigned value.
     *
     * @return the declared or actual frame length
     */
    public long getLength()
    {
        return length;
    }

    public int getMaxFrameSize()
    {
        return maxFrameSize;
    }
}
