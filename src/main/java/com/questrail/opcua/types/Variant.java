package com.questrail.opcua.types;

import java.util.Arrays;
import java.util.Objects;

/**
 * OPC UA Variant: a self-describing container for a single value.
 *
 * <p>A variant holds one of:</p>
 * <ul>
 *   <li>nothing ({@link #NULL})</li>
 *   <li>a scalar of its declared {@link BuiltInType}</li>
 *   <li>a one-dimensional {@code Object[]} whose elements all belong to the
 *       declared type</li>
 *   <li>a {@link Matrix} of the declared type</li>
 * </ul>
 *
 * <p>Construction validates every element against the declared type, so an
 * inconsistent variant can never reach an encoder. Enumeration values are
 * stored as {@link BuiltInType#INT32}, which is how every wire format carries
 * them.</p>
 */
public final class Variant
{
    public static final Variant NULL = new Variant(BuiltInType.NULL, null);

    private final BuiltInType type;
    private final Object value;

    private Variant(BuiltInType type, Object value)
    {
        this.type = type;
        this.value = value;
    }

    /**
     * Scalar variant.
     *
     * @throws IllegalArgumentException if the value does not belong to the type
     */
    public static Variant of(BuiltInType type, Object value)
    {
        Objects.requireNonNull(type, "type");
        if (type == BuiltInType.NULL) {
            if (value != null) {
                throw new IllegalArgumentException("Null variant cannot hold a value");
            }
            return NULL;
        }
        if (type == BuiltInType.VARIANT) {
            throw new IllegalArgumentException("A Variant cannot hold a scalar Variant");
        }
        if (value == null) {
            throw new IllegalArgumentException("Scalar variant of " + type + " requires a value");
        }
        checkElement(type, value);
        return new Variant(normalize(type), value);
    }

    /**
     * One-dimensional array variant. The array is copied.
     */
    public static Variant ofArray(BuiltInType type, Object[] values)
    {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(values, "values");
        if (type == BuiltInType.NULL) {
            throw new IllegalArgumentException("Array variant requires an element type");
        }
        for (Object element : values) {
            checkElement(type, element);
        }
        return new Variant(normalize(type), values.clone());
    }

    public static Variant ofMatrix(Matrix matrix)
    {
        Objects.requireNonNull(matrix, "matrix");
        BuiltInType type = matrix.elementType();
        if (type == BuiltInType.ENUMERATION) {
            matrix = new Matrix(BuiltInType.INT32, matrix.elements(), matrix.dimensions());
        }
        return new Variant(matrix.elementType(), matrix);
    }

    public static Variant ofBoolean(boolean value) { return of(BuiltInType.BOOLEAN, value); }
    public static Variant ofSByte(byte value) { return of(BuiltInType.SBYTE, value); }
    public static Variant ofByte(int value) { return of(BuiltInType.BYTE, (short) value); }
    public static Variant ofInt16(short value) { return of(BuiltInType.INT16, value); }
    public static Variant ofUInt16(int value) { return of(BuiltInType.UINT16, value); }
    public static Variant ofInt32(int value) { return of(BuiltInType.INT32, value); }
    public static Variant ofUInt32(long value) { return of(BuiltInType.UINT32, value); }
    public static Variant ofInt64(long value) { return of(BuiltInType.INT64, value); }
    public static Variant ofUInt64(long value) { return of(BuiltInType.UINT64, value); }
    public static Variant ofFloat(float value) { return of(BuiltInType.FLOAT, value); }
    public static Variant ofDouble(double value) { return of(BuiltInType.DOUBLE, value); }
    public static Variant ofString(String value) { return of(BuiltInType.STRING, value); }
    public static Variant ofDateTime(DateTime value) { return of(BuiltInType.DATE_TIME, value); }

    /**
     * Declared element type ({@link BuiltInType#NULL} for the null variant).
     */
    public BuiltInType type()
    {
        return type;
    }

    /**
     * The scalar value, a copy of the array, or the matrix.
     */
    public Object value()
    {
        return value instanceof Object[] array ? array.clone() : value;
    }

    public boolean isNull()
    {
        return type == BuiltInType.NULL;
    }

    public boolean isArray()
    {
        return value instanceof Object[];
    }

    public boolean isMatrix()
    {
        return value instanceof Matrix;
    }

    /**
     * -1 for scalars (and null), 1 for arrays, the dimension count for matrices.
     */
    public int valueRank()
    {
        if (value instanceof Object[]) {
            return 1;
        }
        if (value instanceof Matrix matrix) {
            return matrix.dimensions().length;
        }
        return -1;
    }

    /**
     * Dimension lengths; empty for scalars.
     */
    public int[] arrayDimensions()
    {
        if (value instanceof Object[] array) {
            return new int[] { array.length };
        }
        if (value instanceof Matrix matrix) {
            return matrix.dimensions();
        }
        return new int[0];
    }

    static BuiltInType normalize(BuiltInType type)
    {
        return type == BuiltInType.ENUMERATION ? BuiltInType.INT32 : type;
    }

    /**
     * @throws IllegalArgumentException if {@code element} cannot be a value of {@code type}
     */
    static void checkElement(BuiltInType type, Object element)
    {
        if (element == null) {
            if (!type.isNullable()) {
                throw new IllegalArgumentException("Null element is not allowed for " + type);
            }
            return;
        }
        if (!type.javaType().isInstance(element)) {
            throw new IllegalArgumentException("Element of class " + element.getClass().getSimpleName()
                    + " does not match declared type " + type
                    + " (expected " + type.javaType().getSimpleName() + ")");
        }
        switch (type) {
            case BYTE -> checkRange(type, (Short) element, 0, 0xFF);
            case UINT16 -> checkRange(type, (Integer) element, 0, 0xFFFF);
            case UINT32 -> checkRange(type, (Long) element, 0, 0xFFFF_FFFFL);
            default -> { }
        }
    }

    private static void checkRange(BuiltInType type, long value, long min, long max)
    {
        if (value < min || value > max) {
            throw new IllegalArgumentException(type + " value out of range: " + value);
        }
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof Variant that)) return false;
        if (type != that.type) return false;
        if (value instanceof Object[] a && that.value instanceof Object[] b) {
            return Arrays.deepEquals(a, b);
        }
        return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode()
    {
        int valueHash = value instanceof Object[] array ? Arrays.deepHashCode(array) : Objects.hashCode(value);
        return 31 * type.hashCode() + valueHash;
    }

    @Override
    public String toString()
    {
        if (isNull()) {
            return "Variant[null]";
        }
        String text = value instanceof Object[] array ? Arrays.deepToString(array) : String.valueOf(value);
        return "Variant[" + type + ": " + text + "]";
    }
}
