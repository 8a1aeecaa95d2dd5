package com.questrail.opcua.codec;

import com.questrail.opcua.types.ExpandedNodeId;

import java.util.Objects;
import java.util.function.Function;

/**
 * EncodeableType
 * -----------------------------------------------------------------------------
 * Descriptor of one structured data type.
 *
 * <p>All ids are stored with an explicit namespace URI (namespace-0 ids may
 * also be given by index), so a descriptor does not depend on any particular
 * namespace table. The {@code decoder} reads the fields in the same order
 * {@link Encodeable#encode(UaEncoder)} writes them.</p>
 *
 * @param name             browse name of the type; the XML element name of its body
 * @param javaType         class of the decoded values
 * @param dataTypeId       id of the data type node
 * @param binaryEncodingId type id used by binary extension objects and messages
 * @param xmlEncodingId    type id used by XML extension objects
 * @param jsonEncodingId   type id used by JSON extension objects
 * @param xmlNamespace     namespace qualifying the type's fields in XML
 */
public record EncodeableType<T extends Encodeable>(
        String name,
        Class<T> javaType,
        ExpandedNodeId dataTypeId,
        ExpandedNodeId binaryEncodingId,
        ExpandedNodeId xmlEncodingId,
        ExpandedNodeId jsonEncodingId,
        String xmlNamespace,
        Function<UaDecoder, T> decoder
) {
    public static final String TYPES_NAMESPACE = "http://opcfoundation.org/UA/2008/02/Types.xsd";

    public EncodeableType {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(javaType, "javaType");
        Objects.requireNonNull(decoder, "decoder");
        dataTypeId = absolute(dataTypeId, "dataTypeId");
        binaryEncodingId = absolute(binaryEncodingId, "binaryEncodingId");
        xmlEncodingId = absolute(xmlEncodingId, "xmlEncodingId");
        jsonEncodingId = absolute(jsonEncodingId, "jsonEncodingId");
        if (xmlNamespace == null) {
            xmlNamespace = NamespaceTable.OPC_UA_NAMESPACE.equals(dataTypeId.namespaceUri())
                    ? TYPES_NAMESPACE
                    : dataTypeId.namespaceUri();
        }
    }

    public static <T extends Encodeable> Builder<T> builder(String name, Class<T> javaType)
    {
        return new Builder<>(name, javaType);
    }

    public T decode(UaDecoder decoder)
    {
        return this.decoder.apply(decoder);
    }

    /**
     * Type id written in front of a body in the given format.
     */
    public ExpandedNodeId encodingId(EncodingFormat format)
    {
        return switch (format) {
            case BINARY -> binaryEncodingId;
            case XML -> xmlEncodingId;
            case JSON -> jsonEncodingId;
        };
    }

    public boolean isInstance(Object value)
    {
        return javaType.isInstance(value);
    }

    private static ExpandedNodeId absolute(ExpandedNodeId id, String what)
    {
        Objects.requireNonNull(id, what);
        if (id.namespaceUri() != null) {
            return id;
        }
        if (id.namespaceIndex() != 0) {
            throw new IllegalArgumentException(what + " must carry a namespace URI: " + id);
        }
        return new ExpandedNodeId(id.nodeId(), NamespaceTable.OPC_UA_NAMESPACE, id.serverIndex());
    }

    public static final class Builder<T extends Encodeable>
    {
        private final String name;
        private final Class<T> javaType;
        private ExpandedNodeId dataTypeId;
        private ExpandedNodeId binaryEncodingId;
        private ExpandedNodeId xmlEncodingId;
        private ExpandedNodeId jsonEncodingId;
        private String xmlNamespace;
        private Function<UaDecoder, T> decoder;

        private Builder(String name, Class<T> javaType)
        {
            this.name = name;
            this.javaType = javaType;
        }

        public Builder<T> withDataTypeId(ExpandedNodeId dataTypeId)
        {
            this.dataTypeId = dataTypeId;
            return this;
        }

        public Builder<T> withBinaryEncodingId(ExpandedNodeId binaryEncodingId)
        {
            this.binaryEncodingId = binaryEncodingId;
            return this;
        }

        public Builder<T> withXmlEncodingId(ExpandedNodeId xmlEncodingId)
        {
            this.xmlEncodingId = xmlEncodingId;
            return this;
        }

        public Builder<T> withJsonEncodingId(ExpandedNodeId jsonEncodingId)
        {
            this.jsonEncodingId = jsonEncodingId;
            return this;
        }

        public Builder<T> withXmlNamespace(String xmlNamespace)
        {
            this.xmlNamespace = xmlNamespace;
            return this;
        }

        public Builder<T> withDecoder(Function<UaDecoder, T> decoder)
        {
            this.decoder = decoder;
            return this;
        }

        /**
         * Missing encoding ids default to the data type id.
         */
        public EncodeableType<T> build()
        {
            Objects.requireNonNull(dataTypeId, "dataTypeId");
            return new EncodeableType<>(name, javaType, dataTypeId,
                    binaryEncodingId != null ? binaryEncodingId : dataTypeId,
                    xmlEncodingId != null ? xmlEncodingId : dataTypeId,
                    jsonEncodingId != null ? jsonEncodingId : dataTypeId,
                    xmlNamespace, decoder);
        }
    }
}
