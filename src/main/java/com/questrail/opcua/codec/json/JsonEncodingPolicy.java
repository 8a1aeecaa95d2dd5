package com.questrail.opcua.codec.json;

import java.util.Objects;

/**
 * Switches that turn the single JSON encoder into one of the four variants.
 *
 * @param tagAmbiguousValues         write {@code Type}/{@code UaType} discriminators
 *                                   so values can be decoded without a schema
 * @param useDisplayStrings          write namespace and server URIs, plain text
 *                                   for LocalizedText and nested arrays for matrices
 * @param compactIdentifiers         write NodeIds and QualifiedNames as strings and
 *                                   structures inline in extension objects
 * @param verboseExtraFields         add status code symbols and enumeration names
 * @param includeDefaultValues       write null strings, null ids and minimum dates
 * @param includeDefaultNumberValues write zero numbers and {@code false}
 */
public record JsonEncodingPolicy(
        JsonEncodingType type,
        boolean tagAmbiguousValues,
        boolean useDisplayStrings,
        boolean compactIdentifiers,
        boolean verboseExtraFields,
        boolean includeDefaultValues,
        boolean includeDefaultNumberValues
) {
    public static final JsonEncodingPolicy REVERSIBLE =
            new JsonEncodingPolicy(JsonEncodingType.REVERSIBLE, true, false, false, false, false, true);
    public static final JsonEncodingPolicy NON_REVERSIBLE =
            new JsonEncodingPolicy(JsonEncodingType.NON_REVERSIBLE, false, true, false, true, true, true);
    public static final JsonEncodingPolicy COMPACT =
            new JsonEncodingPolicy(JsonEncodingType.COMPACT, true, false, true, false, false, false);
    public static final JsonEncodingPolicy VERBOSE =
            new JsonEncodingPolicy(JsonEncodingType.VERBOSE, true, false, false, true, true, true);

    public JsonEncodingPolicy {
        Objects.requireNonNull(type, "type");
    }

    public static JsonEncodingPolicy forType(JsonEncodingType type)
    {
        return switch (type) {
            case REVERSIBLE -> REVERSIBLE;
            case NON_REVERSIBLE -> NON_REVERSIBLE;
            case COMPACT -> COMPACT;
            case VERBOSE -> VERBOSE;
        };
    }

    public JsonEncodingPolicy withIncludeDefaultValues(boolean includeDefaultValues)
    {
        return new JsonEncodingPolicy(type, tagAmbiguousValues, useDisplayStrings, compactIdentifiers,
                verboseExtraFields, includeDefaultValues, includeDefaultNumberValues);
    }

    public JsonEncodingPolicy withIncludeDefaultNumberValues(boolean includeDefaultNumberValues)
    {
        return new JsonEncodingPolicy(type, tagAmbiguousValues, useDisplayStrings, compactIdentifiers,
                verboseExtraFields, includeDefaultValues, includeDefaultNumberValues);
    }

    public boolean isReversible()
    {
        return type != JsonEncodingType.NON_REVERSIBLE;
    }
}
