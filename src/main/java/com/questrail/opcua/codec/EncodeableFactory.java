package com.questrail.opcua.codec;

import com.questrail.opcua.types.ExpandedNodeId;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * EncodeableFactory
 * -----------------------------------------------------------------------------
 * Registry mapping type ids to {@link EncodeableType} descriptors.
 *
 * <p>A factory is assembled once through {@link #builder()} and is immutable
 * afterwards, so one instance can be shared by any number of concurrent
 * encoders and decoders. Every registered type answers to its data type id
 * and to each of its encoding ids.</p>
 *
 * <p>Lookups are keyed by (namespace URI, identifier). Namespace indices are
 * resolved through the caller's {@link NamespaceTable}, which is what makes
 * one factory usable with peers whose tables are ordered differently.</p>
 */
public final class EncodeableFactory
{
    private static final EncodeableFactory EMPTY = new EncodeableFactory(Map.of());

    private final Map<Key, EncodeableType<?>> byId;

    private EncodeableFactory(Map<Key, EncodeableType<?>> byId)
    {
        this.byId = byId;
    }

    public static EncodeableFactory empty()
    {
        return EMPTY;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * Descriptor registered for {@code typeId}. Ids on another server, or
     * whose namespace index is not in {@code namespaces}, never resolve.
     */
    public Optional<EncodeableType<?>> resolve(ExpandedNodeId typeId, NamespaceTable namespaces)
    {
        if (typeId == null || !typeId.isLocal()) {
            return Optional.empty();
        }
        String uri = typeId.namespaceUri();
        if (uri == null) {
            uri = namespaces.uriAt(typeId.namespaceIndex());
            if (uri == null) {
                return Optional.empty();
            }
        }
        return Optional.ofNullable(byId.get(new Key(uri, typeId.identifier())));
    }

    public Collection<EncodeableType<?>> types()
    {
        return Collections.unmodifiableCollection(new LinkedHashSet<>(byId.values()));
    }

    public boolean isEmpty()
    {
        return byId.isEmpty();
    }

    private record Key(String namespaceUri, Object identifier) {
    }

    public static final class Builder
    {
        private final Map<Key, EncodeableType<?>> byId = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Registers {@code type} under its data type id and encoding ids.
         */
        public Builder register(EncodeableType<?> type)
        {
            Objects.requireNonNull(type, "type");
            register(type.dataTypeId(), type);
            register(type.binaryEncodingId(), type);
            register(type.xmlEncodingId(), type);
            register(type.jsonEncodingId(), type);
            return this;
        }

        /**
         * Registers {@code type} under one additional id.
         *
         * @throws IllegalArgumentException if the id is already bound to
         *         another type, or carries neither a URI nor namespace 0
         */
        public Builder register(ExpandedNodeId id, EncodeableType<?> type)
        {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(type, "type");
            String uri = id.namespaceUri();
            if (uri == null) {
                if (id.namespaceIndex() != 0) {
                    throw new IllegalArgumentException("Registered ids need a namespace URI: " + id);
                }
                uri = NamespaceTable.OPC_UA_NAMESPACE;
            }
            Key key = new Key(uri, id.identifier());
            EncodeableType<?> existing = byId.putIfAbsent(key, type);
            if (existing != null && existing != type) {
                throw new IllegalArgumentException("Id " + id + " is already registered for "
                        + existing.name() + ", cannot register " + type.name());
            }
            return this;
        }

        public Builder registerAll(EncodeableFactory factory)
        {
            factory.byId.forEach((key, type) -> {
                EncodeableType<?> existing = byId.putIfAbsent(key, type);
                if (existing != null && existing != type) {
                    throw new IllegalArgumentException("Conflicting registration for " + key);
                }
            });
            return this;
        }

        public EncodeableFactory build()
        {
            return new EncodeableFactory(Map.copyOf(byId));
        }
    }
}
