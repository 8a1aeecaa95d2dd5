package com.questrail.opcua.codec;

/**
 * Indicates a programming error inside the codec or its callers: an
 * unbalanced namespace push/pop, or a matrix whose element count does not
 * match its dimensions.
 *
 * <p>Adversarial input alone never raises this exception, and the codec never
 * catches it.</p>
 */
public final class InvariantViolationException extends IllegalStateException
{
    public InvariantViolationException(String message)
    {
        super(message);
    }
}
