package com.questrail.opcua.codec;

/**
 * Handle for one {@link NamespaceStack#push(String)}; closing it pops that
 * entry.
 */
public final class NamespaceScope implements AutoCloseable
{
    private final NamespaceStack stack;
    private final int depth;
    private final String namespaceUri;

    NamespaceScope(NamespaceStack stack, int depth, String namespaceUri)
    {
        this.stack = stack;
        this.depth = depth;
        this.namespaceUri = namespaceUri;
    }

    public String namespaceUri()
    {
        return namespaceUri;
    }

    /**
     * @throws InvariantViolationException if this entry is no longer on top
     *         of the stack
     */
    @Override
    public void close()
    {
        stack.popScope(depth, namespaceUri);
    }
}
