package com.questrail.opcua.config;

/**
 * Resource limits applied by every encoder and decoder.
 *
 * <p>A limit of {@code 0} disables that check. Lengths are counted in
 * characters for strings, bytes for byte strings and messages, and elements
 * for arrays. {@code maxNestingLevels} bounds the depth of nested structures,
 * variants, extension objects, data values and diagnostic infos.</p>
 */
public record EncodingLimits(
    int maxStringLength,
    int maxByteStringLength,
    int maxArrayLength,
    int maxMessageSize,
    int maxNestingLevels
) {
    public static final int DEFAULT_MAX_STRING_LENGTH = 4 * 1024 * 1024;
    public static final int DEFAULT_MAX_BYTE_STRING_LENGTH = 4 * 1024 * 1024;
    public static final int DEFAULT_MAX_ARRAY_LENGTH = 65_535;
    public static final int DEFAULT_MAX_MESSAGE_SIZE = 4 * 1024 * 1024;
    public static final int DEFAULT_MAX_NESTING_LEVELS = 200;

    public EncodingLimits {
        requireNonNegative(maxStringLength, "maxStringLength");
        requireNonNegative(maxByteStringLength, "maxByteStringLength");
        requireNonNegative(maxArrayLength, "maxArrayLength");
        requireNonNegative(maxMessageSize, "maxMessageSize");
        requireNonNegative(maxNestingLevels, "maxNestingLevels");
    }

    public static EncodingLimits defaults() {
        return builder().build();
    }

    /**
     * No limits at all. Only for trusted input.
     */
    public static EncodingLimits unlimited() {
        return new EncodingLimits(0, 0, 0, 0, 0);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .withMaxStringLength(maxStringLength)
            .withMaxByteStringLength(maxByteStringLength)
            .withMaxArrayLength(maxArrayLength)
            .withMaxMessageSize(maxMessageSize)
            .withMaxNestingLevels(maxNestingLevels);
    }

    private static void requireNonNegative(int value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be >= 0 (was " + value + ")");
        }
    }

    public static final class Builder {
        private int maxStringLength = DEFAULT_MAX_STRING_LENGTH;
        private int maxByteStringLength = DEFAULT_MAX_BYTE_STRING_LENGTH;
        private int maxArrayLength = DEFAULT_MAX_ARRAY_LENGTH;
        private int maxMessageSize = DEFAULT_MAX_MESSAGE_SIZE;
        private int maxNestingLevels = DEFAULT_MAX_NESTING_LEVELS;

        public Builder withMaxStringLength(int maxStringLength) {
            this.maxStringLength = maxStringLength;
            return this;
        }

        public Builder withMaxByteStringLength(int maxByteStringLength) {
            this.maxByteStringLength = maxByteStringLength;
            return this;
        }

        public Builder withMaxArrayLength(int maxArrayLength) {
            this.maxArrayLength = maxArrayLength;
            return this;
        }

        public Builder withMaxMessageSize(int maxMessageSize) {
            this.maxMessageSize = maxMessageSize;
            return this;
        }

        public Builder withMaxNestingLevels(int maxNestingLevels) {
            this.maxNestingLevels = maxNestingLevels;
            return this;
        }

        public EncodingLimits build() {
            return new EncodingLimits(maxStringLength, maxByteStringLength, maxArrayLength,
                maxMessageSize, maxNestingLevels);
        }
    }
}
