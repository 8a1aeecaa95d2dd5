package com.questrail.opcua.types;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class NodeIdTest
{
    @Test
    void parsesEachIdentifierKind()
    {
        assertEquals(NodeId.numeric(0, 85), NodeId.parse("i=85"));
        assertEquals(NodeId.string(2, "Pump"), NodeId.parse("ns=2;s=Pump"));
        assertEquals(NodeId.guid(1, UUID.fromString("72962b91-fa75-4ae6-8d28-b404dc7daf63")),
                NodeId.parse("ns=1;g=72962b91-fa75-4ae6-8d28-b404dc7daf63"));
        assertEquals(NodeId.opaque(3, ByteString.of(new byte[] { 1, 2, 3 })), NodeId.parse("ns=3;b=AQID"));
    }

    @Test
    void textFormIsStable()
    {
        NodeId id = NodeId.string(4, "Line;1");

        assertEquals("ns=4;s=Line;1", id.toParseableString());
        assertEquals(id, NodeId.parse(id.toParseableString()));
    }

    @Test
    void rejectsOutOfRangeValues()
    {
        assertThrows(IllegalArgumentException.class, () -> NodeId.numeric(0x1_0000, 1));
        assertThrows(IllegalArgumentException.class, () -> NodeId.numeric(0, 0x1_0000_0000L));
        assertThrows(IllegalArgumentException.class, () -> NodeId.parse("x=1"));
        assertThrows(IllegalArgumentException.class, () -> NodeId.parse("ns=1"));
    }

    @Test
    void nullNodeId()
    {
        assertTrue(NodeId.NULL.isNull());
        assertFalse(NodeId.numeric(1, 0).isNull());
    }

    @Test
    void expandedNodeIdWithUriAndServer()
    {
        ExpandedNodeId id = ExpandedNodeId.parse("svr=2;nsu=urn:plant%3Bline;s=Pump");

        assertEquals(2, id.serverIndex());
        assertEquals("urn:plant;line", id.namespaceUri());
        assertEquals("Pump", id.identifier());
        assertFalse(id.isLocal());
        assertEquals("svr=2;nsu=urn:plant%3Bline;s=Pump", id.toParseableString());
    }

    @Test
    void expandedNodeIdWithIndex()
    {
        ExpandedNodeId id = ExpandedNodeId.parse("ns=3;i=7");

        assertNull(id.namespaceUri());
        assertEquals(3, id.namespaceIndex());
        assertTrue(id.isLocal());
        assertEquals(ExpandedNodeId.of(NodeId.numeric(3, 7)), id);
    }

    @Test
    void qualifiedNameTextForm()
    {
        assertEquals(new QualifiedName(2, "Temperature"), QualifiedName.parse("2:Temperature"));
        assertEquals(new QualifiedName(0, "Temperature"), QualifiedName.parse("Temperature"));
        assertEquals(new QualifiedName(0, "a:b"), QualifiedName.parse("a:b"));
        assertEquals("2:Temperature", new QualifiedName(2, "Temperature").toParseableString());
    }
}
