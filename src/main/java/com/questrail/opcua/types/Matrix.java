package com.questrail.opcua.types;

import com.questrail.opcua.codec.InvariantViolationException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Multi-dimensional array of a single {@link BuiltInType}.
 *
 * <p>Elements are held flattened in row-major order (the last dimension
 * varies fastest) next to the list of dimension lengths. A matrix always has
 * at least two dimensions, each of positive length, and
 * {@code elements.length == product(dimensions)}.</p>
 */
public final class Matrix
{
    private final BuiltInType elementType;
    private final Object[] elements;
    private final int[] dimensions;

    /**
     * @throws InvariantViolationException if the element count does not match
     *         the dimensions
     * @throws IllegalArgumentException if an element does not belong to the
     *         element type
     */
    public Matrix(BuiltInType elementType, Object[] elements, int[] dimensions)
    {
        this.elementType = Objects.requireNonNull(elementType, "elementType");
        Objects.requireNonNull(elements, "elements");
        Objects.requireNonNull(dimensions, "dimensions");

        if (dimensions.length < 2) {
            throw new InvariantViolationException(
                    "Matrix requires at least two dimensions (was " + dimensions.length + ")");
        }
        long product = 1;
        for (int dimension : dimensions) {
            if (dimension <= 0) {
                throw new InvariantViolationException(
                        "Matrix dimensions must be positive: " + Arrays.toString(dimensions));
            }
            product *= dimension;
            if (product > Integer.MAX_VALUE) {
                throw new InvariantViolationException(
                        "Matrix dimensions overflow: " + Arrays.toString(dimensions));
            }
        }
        if (product != elements.length) {
            throw new InvariantViolationException("Matrix has " + elements.length
                    + " elements but dimensions " + Arrays.toString(dimensions)
                    + " require " + product);
        }
        for (Object element : elements) {
            Variant.checkElement(elementType, element);
        }

        this.elements = elements.clone();
        this.dimensions = dimensions.clone();
    }

    /**
     * Builds a matrix from a jagged (nested {@code Object[]}) array whose
     * nesting depth equals the number of dimensions.
     */
    public static Matrix fromJaggedArray(BuiltInType elementType, Object[] jagged)
    {
        int[] dimensions = jaggedDimensions(jagged);
        int count = 1;
        for (int dimension : dimensions) {
            count *= dimension;
        }
        Object[] flat = new Object[count];
        flatten(jagged, 0, dimensions, flat, new int[] { 0 });
        return new Matrix(elementType, flat, dimensions);
    }

    public BuiltInType elementType()
    {
        return elementType;
    }

    public Object[] elements()
    {
        return elements.clone();
    }

    public int[] dimensions()
    {
        return dimensions.clone();
    }

    public int elementCount()
    {
        return elements.length;
    }

    /**
     * Nested {@code Object[]} view with one nesting level per dimension.
     */
    public Object[] toJaggedArray()
    {
        return (Object[]) nest(0, new int[] { 0 });
    }

    private Object nest(int dim, int[] index)
    {
        Object[] level = new Object[dimensions[dim]];
        for (int i = 0; i < level.length; i++) {
            if (dim == dimensions.length - 1) {
                level[i] = elements[index[0]++];
            }
            else {
                level[i] = nest(dim + 1, index);
            }
        }
        return level;
    }

    private static int[] jaggedDimensions(Object[] jagged)
    {
        int depth = 0;
        Object level = jagged;
        int[] scratch = new int[32];
        while (level instanceof Object[] array && !(isLeafArray(array))) {
            if (depth == scratch.length) {
                throw new IllegalArgumentException("Jagged array nests too deeply");
            }
            scratch[depth++] = array.length;
            level = array.length == 0 ? null : array[0];
        }
        if (level instanceof Object[] leaf) {
            scratch[depth++] = leaf.length;
        }
        return Arrays.copyOf(scratch, depth);
    }

    private static boolean isLeafArray(Object[] array)
    {
        return array.length == 0 || !(array[0] instanceof Object[]);
    }

    private static void flatten(Object[] level, int dim, int[] dimensions, Object[] flat, int[] index)
    {
        if (level.length != dimensions[dim]) {
            throw new InvariantViolationException("Jagged array is not rectangular at dimension " + dim);
        }
        for (Object item : level) {
            if (dim == dimensions.length - 1) {
                flat[index[0]++] = item;
            }
            else if (item instanceof Object[] nested) {
                flatten(nested, dim + 1, dimensions, flat, index);
            }
            else {
                throw new InvariantViolationException("Jagged array is not rectangular at dimension " + dim);
            }
        }
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof Matrix that)) return false;
        return elementType == that.elementType
                && Arrays.equals(dimensions, that.dimensions)
                && Arrays.deepEquals(elements, that.elements);
    }

    @Override
    public int hashCode()
    {
        return 31 * (31 * elementType.hashCode() + Arrays.hashCode(dimensions)) + Arrays.deepHashCode(elements);
    }

    @Override
    public String toString()
    {
        return "Matrix[" + elementType + " " + Arrays.toString(dimensions) + "]";
    }
}
