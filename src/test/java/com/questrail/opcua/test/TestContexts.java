package com.questrail.opcua.test;

import com.questrail.opcua.catalog.StandardTypes;
import com.questrail.opcua.codec.EncodeableFactory;
import com.questrail.opcua.codec.EncodingContext;
import com.questrail.opcua.codec.NamespaceTable;
import com.questrail.opcua.config.EncodingLimits;
import com.questrail.opcua.observability.CodecObservabilitySink;

/**
 * Fresh encoding contexts for tests. Namespace tables grow while decoding, so
 * every encode and every decode gets its own context.
 */
public final class TestContexts
{
    public static final EncodeableFactory FACTORY = StandardTypes.builder()
            .register(SampleStructure.TYPE)
            .register(VariantHolder.TYPE)
            .build();

    private TestContexts() {}

    public static EncodingContext context()
    {
        return builder().build();
    }

    public static EncodingContext context(EncodingLimits limits)
    {
        return builder().withLimits(limits).build();
    }

    public static EncodingContext context(CodecObservabilitySink sink)
    {
        return builder().withObservabilitySink(sink).build();
    }

    public static EncodingContext.Builder builder()
    {
        return EncodingContext.builder()
                .withNamespaceTable(NamespaceTable.forApplication(SampleStructure.NAMESPACE))
                .withFactory(FACTORY);
    }
}
