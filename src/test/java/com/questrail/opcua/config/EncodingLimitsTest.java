package com.questrail.opcua.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class EncodingLimitsTest
{
    @Test
    void defaultsAreBounded()
    {
        EncodingLimits limits = EncodingLimits.defaults();

        assertEquals(EncodingLimits.DEFAULT_MAX_STRING_LENGTH, limits.maxStringLength());
        assertEquals(EncodingLimits.DEFAULT_MAX_ARRAY_LENGTH, limits.maxArrayLength());
        assertEquals(EncodingLimits.DEFAULT_MAX_NESTING_LEVELS, limits.maxNestingLevels());
    }

    @Test
    void toBuilderChangesOneLimit()
    {
        EncodingLimits limits = EncodingLimits.defaults().toBuilder().withMaxArrayLength(10).build();

        assertEquals(10, limits.maxArrayLength());
        assertEquals(EncodingLimits.DEFAULT_MAX_MESSAGE_SIZE, limits.maxMessageSize());
    }

    @Test
    void negativeLimitsAreRejected()
    {
        assertThrows(IllegalArgumentException.class,
                () -> EncodingLimits.builder().withMaxNestingLevels(-1).build());
    }
}
