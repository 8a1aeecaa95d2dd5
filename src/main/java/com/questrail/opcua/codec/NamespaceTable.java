package com.questrail.opcua.codec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * NamespaceTable
 * -----------------------------------------------------------------------------
 * Ordered list of URIs addressed by index.
 *
 * <p>Used for two tables with the same shape:</p>
 * <ul>
 *   <li>the namespace table, where index 0 is always the OPC UA namespace and
 *       index 1 is the application's own namespace</li>
 *   <li>the server table, where index 0 is the local server</li>
 * </ul>
 *
 * <p>Indices are stable: URIs are only ever appended. A table is owned by one
 * message context and is not thread safe.</p>
 */
public final class NamespaceTable
{
    public static final String OPC_UA_NAMESPACE = "http://opcfoundation.org/UA/";

    private final List<String> uris = new ArrayList<>();
    private final Map<String, Integer> indices = new HashMap<>();

    private NamespaceTable(List<String> initial)
    {
        for (String uri : initial) {
            getOrAppend(uri);
        }
    }

    /**
     * Namespace table holding only the OPC UA namespace at index 0.
     */
    public static NamespaceTable standard()
    {
        return new NamespaceTable(List.of(OPC_UA_NAMESPACE));
    }

    /**
     * Namespace table with the OPC UA namespace at index 0 and the given
     * application URI at index 1.
     */
    public static NamespaceTable forApplication(String applicationUri)
    {
        return new NamespaceTable(List.of(OPC_UA_NAMESPACE, applicationUri));
    }

    /**
     * Server table with the local server URI at index 0.
     */
    public static NamespaceTable forServer(String localServerUri)
    {
        return new NamespaceTable(List.of(localServerUri));
    }

    public static NamespaceTable of(String... uris)
    {
        return new NamespaceTable(List.of(uris));
    }

    /**
     * Index of {@code uri}, appending it first if it is not present.
     */
    public int getOrAppend(String uri)
    {
        Objects.requireNonNull(uri, "uri");
        Integer index = indices.get(uri);
        if (index != null) {
            return index;
        }
        if (uris.size() > 0xFFFF) {
            throw CodecException.limitsExceeded("Namespace table is full");
        }
        uris.add(uri);
        indices.put(uri, uris.size() - 1);
        return uris.size() - 1;
    }

    /**
     * URI at {@code index}, or {@code null} if the index is not in the table.
     */
    public String uriAt(int index)
    {
        return index >= 0 && index < uris.size() ? uris.get(index) : null;
    }

    /**
     * Index of {@code uri}, or {@code -1} if it is not in the table.
     */
    public int indexOf(String uri)
    {
        Integer index = indices.get(uri);
        return index == null ? -1 : index;
    }

    public int size()
    {
        return uris.size();
    }

    public List<String> uris()
    {
        return Collections.unmodifiableList(uris);
    }

    @Override
    public String toString()
    {
        return "NamespaceTable" + uris;
    }
}
