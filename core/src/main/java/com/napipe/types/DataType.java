package com.napipe.types;

/**
 * Sealed interface for all column types in the napipe type system.
 *
 * <p>A column is either a scalar of one item type or a vector of items of one
 * item type. Vectors have either a known length or an unknown (variable) length.
 *
 * <p>Item types include:
 * <ul>
 *   <li>Numeric types: ByteType, ShortType, IntegerType, LongType, FloatType, DoubleType</li>
 *   <li>Temporal types: TimeSpanType, TimestampType</li>
 *   <li>Other types: BooleanType, StringType</li>
 * </ul>
 */
public sealed interface DataType
    permits BooleanType, ByteType, ShortType, IntegerType, LongType,
            FloatType, DoubleType, StringType,
            TimeSpanType, TimestampType, VectorType {

    /**
     * Returns a human-readable name for this data type.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Returns the kind of the items held by this type.
     *
     * <p>For vectors this is the kind of the element type.
     *
     * @return the item kind
     */
    ItemKind itemKind();

    /**
     * Returns the item type: the element type for vectors, this type otherwise.
     *
     * @return the item type
     */
    default DataType itemType() {
        return this;
    }

    /**
     * Returns whether this is a vector type.
     *
     * @return true for vectors
     */
    default boolean isVector() {
        return false;
    }
}
