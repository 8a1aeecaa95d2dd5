package com.questrail.opcua.codec;

import com.questrail.opcua.catalog.Range;
import com.questrail.opcua.catalog.StandardTypes;
import com.questrail.opcua.test.SampleStructure;
import com.questrail.opcua.test.TestContexts;
import com.questrail.opcua.test.VariantHolder;
import com.questrail.opcua.types.ExpandedNodeId;
import com.questrail.opcua.types.NodeId;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * EncodeableFactoryTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link EncodeableFactory} and {@link EncodeableType}.
 */
final class EncodeableFactoryTest
{
    @Test
    void everyEncodingIdResolvesToTheSameType()
    {
        NamespaceTable namespaces = NamespaceTable.standard();

        for (long id : new long[]{884, 885, 886, 15375}) {
            assertSame(Range.TYPE, StandardTypes.factory()
                    .resolve(ExpandedNodeId.of(NodeId.numeric(0, id)), namespaces)
                    .orElseThrow());
        }
    }

    @Test
    void resolvesByUriWhateverTheIndex()
    {
        ExpandedNodeId byUri = ExpandedNodeId.numeric(SampleStructure.NAMESPACE, 1001);
        ExpandedNodeId atIndexOne = ExpandedNodeId.of(NodeId.numeric(1, 1001));
        ExpandedNodeId atIndexTwo = ExpandedNodeId.of(NodeId.numeric(2, 1001));

        NamespaceTable ours = NamespaceTable.forApplication(SampleStructure.NAMESPACE);
        NamespaceTable theirs = NamespaceTable.of(NamespaceTable.OPC_UA_NAMESPACE, "urn:other", SampleStructure.NAMESPACE);

        assertTrue(TestContexts.FACTORY.resolve(byUri, NamespaceTable.standard()).isPresent());
        assertTrue(TestContexts.FACTORY.resolve(atIndexOne, ours).isPresent());
        assertTrue(TestContexts.FACTORY.resolve(atIndexTwo, theirs).isPresent());
        assertFalse(TestContexts.FACTORY.resolve(atIndexOne, theirs).isPresent());
    }

    @Test
    void unknownIndexAndRemoteIdsDoNotResolve()
    {
        NamespaceTable namespaces = NamespaceTable.standard();

        assertTrue(TestContexts.FACTORY.resolve(ExpandedNodeId.of(NodeId.numeric(7, 1001)), namespaces).isEmpty());
        assertTrue(TestContexts.FACTORY.resolve(
                new ExpandedNodeId(NodeId.numeric(0, 886), null, 3), namespaces).isEmpty());
        assertTrue(TestContexts.FACTORY.resolve(null, namespaces).isEmpty());
    }

    @Test
    void conflictingRegistrationFails()
    {
        EncodeableType<Range> impostor = EncodeableType.builder("Impostor", Range.class)
                .withDataTypeId(ExpandedNodeId.numeric(null, 884))
                .withDecoder(decoder -> new Range(0, 0))
                .build();

        assertThrows(IllegalArgumentException.class,
                () -> StandardTypes.builder().register(impostor));
    }

    @Test
    void registeringTheSameTypeTwiceIsHarmless()
    {
        EncodeableFactory factory = EncodeableFactory.builder()
                .register(Range.TYPE)
                .register(Range.TYPE)
                .build();

        assertEquals(1, factory.types().size());
    }

    @Test
    void idsOutsideNamespaceZeroNeedAUri()
    {
        assertThrows(IllegalArgumentException.class, () -> EncodeableType.builder("Bad", Range.class)
                .withDataTypeId(ExpandedNodeId.of(NodeId.numeric(3, 1)))
                .withDecoder(decoder -> new Range(0, 0))
                .build());
    }

    @Test
    void encodingIdsDefaultToTheDataTypeId()
    {
        EncodeableType<Range> type = EncodeableType.builder("Plain", Range.class)
                .withDataTypeId(ExpandedNodeId.numeric("urn:plain", 5))
                .withDecoder(decoder -> new Range(0, 0))
                .build();

        assertEquals(type.dataTypeId(), type.encodingId(EncodingFormat.BINARY));
        assertEquals(type.dataTypeId(), type.encodingId(EncodingFormat.JSON));
        assertEquals("urn:plain", type.xmlNamespace());
    }

    @Test
    void standardTypesUseTheTypesSchemaNamespace()
    {
        assertEquals(EncodeableType.TYPES_NAMESPACE, Range.TYPE.xmlNamespace());
        assertEquals(NamespaceTable.OPC_UA_NAMESPACE, Range.TYPE.dataTypeId().namespaceUri());
    }

    @Test
    void registerAllMergesFactories()
    {
        EncodeableFactory merged = EncodeableFactory.builder()
                .registerAll(StandardTypes.factory())
                .register(SampleStructure.TYPE)
                .register(VariantHolder.TYPE)
                .build();

        assertEquals(TestContexts.FACTORY.types().size(), merged.types().size());
        assertTrue(EncodeableFactory.empty().isEmpty());
    }
}
