package com.questrail.opcua.codec;

import com.questrail.opcua.config.EncodingLimits;
import com.questrail.opcua.observability.CodecObservabilitySink;
import com.questrail.opcua.observability.NullObservabilitySink;

import java.util.Objects;

/**
 * Everything an encoder or decoder needs besides the value itself.
 *
 * <p>The namespace and server tables belong to one message exchange; the
 * factory, limits and sink are usually shared. A context holds no per-call
 * state, so it may be reused for sequential messages of the same exchange.</p>
 */
public final class EncodingContext
{
    private final NamespaceTable namespaceTable;
    private final NamespaceTable serverTable;
    private final EncodeableFactory factory;
    private final EncodingLimits limits;
    private final CodecObservabilitySink observabilitySink;

    private EncodingContext(Builder builder)
    {
        this.namespaceTable = builder.namespaceTable != null ? builder.namespaceTable : NamespaceTable.standard();
        this.serverTable = builder.serverTable != null ? builder.serverTable : NamespaceTable.of();
        this.factory = builder.factory != null ? builder.factory : EncodeableFactory.empty();
        this.limits = builder.limits != null ? builder.limits : EncodingLimits.defaults();
        this.observabilitySink = builder.observabilitySink != null
                ? builder.observabilitySink
                : NullObservabilitySink.INSTANCE;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public NamespaceTable namespaceTable()
    {
        return namespaceTable;
    }

    public NamespaceTable serverTable()
    {
        return serverTable;
    }

    public EncodeableFactory factory()
    {
        return factory;
    }

    public EncodingLimits limits()
    {
        return limits;
    }

    public CodecObservabilitySink observabilitySink()
    {
        return observabilitySink;
    }

    public static final class Builder
    {
        private NamespaceTable namespaceTable;
        private NamespaceTable serverTable;
        private EncodeableFactory factory;
        private EncodingLimits limits;
        private CodecObservabilitySink observabilitySink;

        private Builder() {}

        public Builder withNamespaceTable(NamespaceTable namespaceTable)
        {
            this.namespaceTable = Objects.requireNonNull(namespaceTable, "namespaceTable");
            return this;
        }

        public Builder withServerTable(NamespaceTable serverTable)
        {
            this.serverTable = Objects.requireNonNull(serverTable, "serverTable");
            return this;
        }

        public Builder withFactory(EncodeableFactory factory)
        {
            this.factory = Objects.requireNonNull(factory, "factory");
            return this;
        }

        public Builder withLimits(EncodingLimits limits)
        {
            this.limits = Objects.requireNonNull(limits, "limits");
            return this;
        }

        public Builder withObservabilitySink(CodecObservabilitySink observabilitySink)
        {
            this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
            return this;
        }

        public EncodingContext build()
        {
            return new EncodingContext(this);
        }
    }
}
