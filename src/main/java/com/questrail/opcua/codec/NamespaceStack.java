package com.questrail.opcua.codec;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Stack of namespace URIs that qualify structure fields while a nested
 * structure is being encoded or decoded.
 *
 * <p>Every push must be matched by exactly one pop, in reverse order.
 * {@link #push(String)} returns a {@link NamespaceScope} so callers can tie
 * the pop to a try-with-resources block.</p>
 */
public final class NamespaceStack
{
    private final Deque<String> uris = new ArrayDeque<>();

    public NamespaceScope push(String namespaceUri)
    {
        Objects.requireNonNull(namespaceUri, "namespaceUri");
        uris.push(namespaceUri);
        return new NamespaceScope(this, uris.size(), namespaceUri);
    }

    /**
     * @throws InvariantViolationException if the stack is empty
     */
    public String pop()
    {
        if (uris.isEmpty()) {
            throw new InvariantViolationException("Namespace pop without matching push");
        }
        return uris.pop();
    }

    /**
     * The namespace on top of the stack, or {@code fallback} when it is empty.
     */
    public String current(String fallback)
    {
        String top = uris.peek();
        return top == null ? fallback : top;
    }

    public int depth()
    {
        return uris.size();
    }

    public boolean isEmpty()
    {
        return uris.isEmpty();
    }

    void popScope(int expectedDepth, String expectedUri)
    {
        if (uris.size() != expectedDepth || !expectedUri.equals(uris.peek())) {
            throw new InvariantViolationException("Namespace scope for " + expectedUri
                + " closed out of order (depth " + uris.size() + ", expected " + expectedDepth + ")");
        }
        uris.pop();
    }
}
