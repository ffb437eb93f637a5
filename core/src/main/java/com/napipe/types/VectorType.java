package com.napipe.types;

import java.util.Objects;

/**
 * Data type representing a vector of items of one scalar item type.
 *
 * <p>A vector has either a known length ({@code size > 0}) or an unknown,
 * variable length ({@code size == 0}). Vectors do not nest.
 *
 * <p>Example: {@code vector<float,3>} for a fixed-length vector of three floats,
 * {@code vector<float>} for a variable-length vector of floats.
 */
public final class VectorType implements DataType {

    private final DataType elementType;
    private final int size;

    /**
     * Creates a vector type.
     *
     * @param elementType the scalar type of the elements
     * @param size the vector length, or 0 for unknown length
     */
    public VectorType(DataType elementType, int size) {
        this.elementType = Objects.requireNonNull(elementType, "elementType must not be null");
        if (elementType.isVector()) {
            throw new IllegalArgumentException("vector element type must be a scalar type: " + elementType);
        }
        if (size < 0) {
            throw new IllegalArgumentException("vector size must not be negative: " + size);
        }
        this.size = size;
    }

    /**
     * Creates a vector type of unknown length.
     *
     * @param elementType the scalar type of the elements
     */
    public VectorType(DataType elementType) {
        this(elementType, 0);
    }

    /**
     * Returns the element type.
     *
     * @return the element type
     */
    public DataType elementType() {
        return elementType;
    }

    /**
     * Returns the vector length, or 0 when the length is unknown.
     *
     * @return the size
     */
    public int size() {
        return size;
    }

    /**
     * Returns whether all values of this type have the same, known length.
     *
     * @return true for fixed-length vectors
     */
    public boolean isKnownSize() {
        return size > 0;
    }

    @Override
    public String typeName() {
        return isKnownSize()
            ? "vector<" + elementType.typeName() + "," + size + ">"
            : "vector<" + elementType.typeName() + ">";
    }

    @Override
    public ItemKind itemKind() {
        return elementType.itemKind();
    }

    @Override
    public DataType itemType() {
        return elementType;
    }

    @Override
    public boolean isVector() {
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof VectorType)) return false;
        VectorType that = (VectorType) obj;
        return size == that.size && Objects.equals(elementType, that.elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elementType, size);
    }

    @Override
    public String toString() {
        return typeName();
    }
}
