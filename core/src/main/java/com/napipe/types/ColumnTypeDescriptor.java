package com.napipe.types;

import java.util.Objects;

/**
 * Resolved shape and item type of one column.
 *
 * @param itemType the scalar item type
 * @param isVector whether the column holds vectors
 * @param hasKnownLength whether every value has the same known length (always true for scalars)
 * @param vectorSize the vector length; 1 for scalars, 0 for vectors of unknown length
 */
public record ColumnTypeDescriptor(DataType itemType, boolean isVector, boolean hasKnownLength, int vectorSize) {

    public ColumnTypeDescriptor {
        Objects.requireNonNull(itemType, "itemType must not be null");
        if (itemType.isVector()) {
            throw new IllegalArgumentException("itemType must be a scalar type: " + itemType);
        }
        if (hasKnownLength != (vectorSize > 0)) {
            throw new IllegalArgumentException(
                "hasKnownLength=" + hasKnownLength + " inconsistent with vectorSize=" + vectorSize);
        }
    }

    /**
     * Describes the given column type.
     *
     * @param type the column type
     * @return the descriptor
     */
    public static ColumnTypeDescriptor of(DataType type) {
        Objects.requireNonNull(type, "type must not be null");
        if (type instanceof VectorType vector) {
            return new ColumnTypeDescriptor(vector.elementType(), true, vector.isKnownSize(), vector.size());
        }
        return new ColumnTypeDescriptor(type, false, true, 1);
    }

    /**
     * Returns whether this column is a vector of unknown length.
     *
     * @return true for variable-length vectors
     */
    public boolean isVariableLengthVector() {
        return isVector && !hasKnownLength;
    }

    /**
     * Rebuilds the column type this descriptor was derived from.
     *
     * @return the column type
     */
    public DataType toDataType() {
        return isVector ? new VectorType(itemType, vectorSize) : itemType;
    }

    @Override
    public String toString() {
        return toDataType().typeName();
    }
}
