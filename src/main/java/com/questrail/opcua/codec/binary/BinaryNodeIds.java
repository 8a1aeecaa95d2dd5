package com.questrail.opcua.codec.binary;

import com.questrail.opcua.codec.CodecException;
import com.questrail.opcua.codec.NamespaceTable;
import com.questrail.opcua.types.ExpandedNodeId;
import com.questrail.opcua.types.NodeId;

/**
 * Encoding-byte constants shared by {@link BinaryEncoder} and
 * {@link BinaryDecoder}.
 */
final class BinaryNodeIds
{
    static final int TWO_BYTE = 0x00;
    static final int FOUR_BYTE = 0x01;
    static final int NUMERIC = 0x02;
    static final int STRING = 0x03;
    static final int GUID = 0x04;
    static final int OPAQUE = 0x05;

    static final int NAMESPACE_URI_FLAG = 0x80;
    static final int SERVER_INDEX_FLAG = 0x40;

    static final int ARRAY_FLAG = 0x80;
    static final int DIMENSIONS_FLAG = 0x40;
    static final int TYPE_MASK = 0x3F;

    private BinaryNodeIds() {}

    /**
     * Converts a type id to the plain NodeId written on the wire, replacing a
     * namespace URI by its index in {@code namespaces}.
     */
    static NodeId toLocal(ExpandedNodeId id, NamespaceTable namespaces)
    {
        if (!id.isLocal()) {
            throw CodecException.encodingError("Type id " + id + " refers to another server");
        }
        if (id.namespaceUri() == null) {
            return id.nodeId();
        }
        int index = namespaces.indexOf(id.namespaceUri());
        if (index < 0) {
            throw CodecException.encodingError(
                    "Namespace " + id.namespaceUri() + " of type id " + id + " is not in the namespace table");
        }
        return new NodeId(index, id.identifier());
    }
}
