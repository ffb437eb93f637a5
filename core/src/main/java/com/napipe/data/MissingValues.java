package com.napipe.data;

import com.napipe.types.BooleanType;
import com.napipe.types.ByteType;
import com.napipe.types.DataType;
import com.napipe.types.DoubleType;
import com.napipe.types.FloatType;
import com.napipe.types.IntegerType;
import com.napipe.types.LongType;
import com.napipe.types.ShortType;
import com.napipe.types.StringType;
import com.napipe.types.TimeSpanType;
import com.napipe.types.TimestampType;

import java.time.Duration;
import java.time.Instant;

/**
 * Missing-value and default-value rules for cell values.
 */
public final class MissingValues {

    private MissingValues() {}

    /**
     * Returns whether a scalar cell value is missing.
     *
     * @param value the cell value
     * @return true for null, and for NaN floats and doubles
     */
    public static boolean isMissing(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Double d) {
            return d.isNaN();
        }
        if (value instanceof Float f) {
            return f.isNaN();
        }
        return false;
    }

    /**
     * Returns the default ("zero or empty") value of a scalar item type.
     *
     * @param itemType the item type
     * @return the default value
     */
    public static Object defaultValue(DataType itemType) {
        if (itemType instanceof BooleanType) return Boolean.FALSE;
        if (itemType instanceof ByteType) return (byte) 0;
        if (itemType instanceof ShortType) return (short) 0;
        if (itemType instanceof IntegerType) return 0;
        if (itemType instanceof LongType) return 0L;
        if (itemType instanceof FloatType) return 0f;
        if (itemType instanceof DoubleType) return 0d;
        if (itemType instanceof StringType) return "";
        if (itemType instanceof TimeSpanType) return Duration.ZERO;
        if (itemType instanceof TimestampType) return Instant.EPOCH;
        throw new IllegalArgumentException("Not a scalar item type: " + itemType);
    }

    /**
     * Returns whether a non-null value is a valid instance of the scalar item type.
     *
     * @param itemType the item type
     * @param value the value
     * @return true if the value's Java class matches the item type
     */
    public static boolean isInstance(DataType itemType, Object value) {
        if (itemType instanceof BooleanType) return value instanceof Boolean;
        if (itemType instanceof ByteType) return value instanceof Byte;
        if (itemType instanceof ShortType) return value instanceof Short;
        if (itemType instanceof IntegerType) return value instanceof Integer;
        if (itemType instanceof LongType) return value instanceof Long;
        if (itemType instanceof FloatType) return value instanceof Float;
        if (itemType instanceof DoubleType) return value instanceof Double;
        if (itemType instanceof StringType) return value instanceof String;
        if (itemType instanceof TimeSpanType) return value instanceof Duration;
        if (itemType instanceof TimestampType) return value instanceof Instant;
        return false;
    }
}
