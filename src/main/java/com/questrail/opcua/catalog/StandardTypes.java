package com.questrail.opcua.catalog;

import com.questrail.opcua.codec.EncodeableFactory;

/**
 * StandardTypes
 * -----------------------------------------------------------------------------
 * The namespace-0 structures this library knows how to decode.
 *
 * <p>{@link #factory()} is shared process-wide. Applications that add their
 * own types start from {@link #builder()} so the standard types stay
 * resolvable:</p>
 *
 * <pre>{@code
 * EncodeableFactory factory = StandardTypes.builder()
 *         .register(PumpStatus.TYPE)
 *         .build();
 * }</pre>
 */
public final class StandardTypes
{
    private static final EncodeableFactory FACTORY = builder().build();

    private StandardTypes() {}

    public static EncodeableFactory factory()
    {
        return FACTORY;
    }

    public static EncodeableFactory.Builder builder()
    {
        return EncodeableFactory.builder()
                .register(Range.TYPE)
                .register(EUInformation.TYPE)
                .register(Argument.TYPE);
    }
}
