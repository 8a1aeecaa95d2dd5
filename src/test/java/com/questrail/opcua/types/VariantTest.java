package com.questrail.opcua.types;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class VariantTest
{
    @Test
    void scalarValueMustMatchType()
    {
        assertThrows(IllegalArgumentException.class, () -> Variant.of(BuiltInType.INT32, "not an int"));
        assertThrows(IllegalArgumentException.class, () -> Variant.of(BuiltInType.BYTE, (short) 256));
        assertThrows(IllegalArgumentException.class, () -> Variant.of(BuiltInType.UINT32, -1L));
    }

    @Test
    void scalarVariantCannotNestVariant()
    {
        assertThrows(IllegalArgumentException.class,
                () -> Variant.of(BuiltInType.VARIANT, Variant.ofInt32(1)));
    }

    @Test
    void arrayOfVariantsIsAllowed()
    {
        Variant variant = Variant.ofArray(BuiltInType.VARIANT,
                new Variant[] { Variant.ofInt32(1), Variant.ofString("two") });

        assertTrue(variant.isArray());
        assertFalse(variant.isMatrix());
        assertEquals(BuiltInType.VARIANT, variant.type());
    }

    @Test
    void nullVariant()
    {
        assertTrue(Variant.NULL.isNull());
        assertSame(Variant.NULL, Variant.of(BuiltInType.NULL, null));
        assertThrows(IllegalArgumentException.class, () -> Variant.of(BuiltInType.NULL, 1));
    }

    @Test
    void enumerationIsStoredAsInt32()
    {
        Variant variant = Variant.of(BuiltInType.ENUMERATION, 5);

        assertEquals(BuiltInType.INT32, variant.type());
        assertEquals(Variant.ofInt32(5), variant);
    }

    @Test
    void matrixVariantReportsDimensions()
    {
        Matrix matrix = new Matrix(BuiltInType.DOUBLE, new Double[] { 1.0, 2.0, 3.0, 4.0, 5.0, 6.0 }, new int[] { 3, 2 });

        Variant variant = Variant.ofMatrix(matrix);

        assertTrue(variant.isMatrix());
        assertEquals(2, variant.valueRank());
        assertArrayEquals(new int[] { 3, 2 }, variant.arrayDimensions());
    }

    @Test
    void arraysCompareByContent()
    {
        Variant a = Variant.ofArray(BuiltInType.STRING, new String[] { "a", "b" });
        Variant b = Variant.ofArray(BuiltInType.STRING, new Object[] { "a", "b" });

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }
}
