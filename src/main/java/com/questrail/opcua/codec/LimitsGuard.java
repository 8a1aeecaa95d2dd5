package com.questrail.opcua.codec;

import com.questrail.opcua.config.EncodingLimits;

/**
 * LimitsGuard
 * -----------------------------------------------------------------------------
 * Applies {@link EncodingLimits} on behalf of one encoder or decoder.
 *
 * <p>Length checks take the length a value <em>declares</em> and run before
 * anything is allocated for it. Nesting is tracked through {@link Level}
 * handles: every structure, variant, extension object, data value and
 * diagnostic info opens one level for as long as it is being processed.</p>
 *
 * <p>All violations raise {@link CodecException} with
 * {@code BadEncodingLimitsExceeded}.</p>
 */
public final class LimitsGuard
{
    private final EncodingLimits limits;
    private int depth;

    public LimitsGuard(EncodingLimits limits)
    {
        this.limits = limits;
    }

    public EncodingLimits limits()
    {
        return limits;
    }

    public void checkStringLength(long length)
    {
        check(length, limits.maxStringLength(), "String length");
    }

    public void checkByteStringLength(long length)
    {
        check(length, limits.maxByteStringLength(), "ByteString length");
    }

    public void checkArrayLength(long length)
    {
        check(length, limits.maxArrayLength(), "Array length");
    }

    public void checkMessageSize(long size)
    {
        check(size, limits.maxMessageSize(), "Message size");
    }

    /**
     * Opens one nesting level.
     *
     * @param what kind of value being entered, for the error message
     */
    public Level enter(String what)
    {
        int max = limits.maxNestingLevels();
        if (max > 0 && depth >= max) {
            throw CodecException.limitsExceeded(
                    "Nesting of " + what + " exceeds " + max + " levels");
        }
        depth++;
        return new Level();
    }

    public int depth()
    {
        return depth;
    }

    private static void check(long value, int max, String what)
    {
        if (max > 0 && value > max) {
            throw CodecException.limitsExceeded(what + " " + value + " exceeds limit " + max);
        }
    }

    /**
     * One open nesting level; closing it returns to the enclosing level.
     */
    public final class Level implements AutoCloseable
    {
        private boolean closed;

        private Level() {}

        @Override
        public void close()
        {
            if (!closed) {
                closed = true;
                depth--;
            }
        }
    }
}
