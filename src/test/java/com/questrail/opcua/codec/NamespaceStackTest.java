package com.questrail.opcua.codec;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NamespaceStackTest
 * -----------------------------------------------------------------------------
 * Every push is matched by one pop in reverse order; anything else is a
 * programming error.
 */
final class NamespaceStackTest
{
    @Test
    void scopesPopInReverseOrder()
    {
        NamespaceStack stack = new NamespaceStack();

        try (NamespaceScope outer = stack.push("urn:outer")) {
            try (NamespaceScope inner = stack.push("urn:inner")) {
                assertEquals("urn:inner", stack.current("urn:none"));
                assertEquals(2, stack.depth());
            }
            assertEquals("urn:outer", stack.current("urn:none"));
        }

        assertTrue(stack.isEmpty());
        assertEquals("urn:none", stack.current("urn:none"));
    }

    @Test
    void closingOutOfOrderIsAnInvariantViolation()
    {
        NamespaceStack stack = new NamespaceStack();
        NamespaceScope outer = stack.push("urn:outer");
        stack.push("urn:inner");

        assertThrows(InvariantViolationException.class, outer::close);
    }

    @Test
    void popWithoutPushIsAnInvariantViolation()
    {
        NamespaceStack stack = new NamespaceStack();

        assertThrows(InvariantViolationException.class, stack::pop);
    }

    @Test
    void closingTwiceIsAnInvariantViolation()
    {
        NamespaceStack stack = new NamespaceStack();
        NamespaceScope scope = stack.push("urn:once");
        scope.close();

        assertThrows(InvariantViolationException.class, scope::close);
    }
}
