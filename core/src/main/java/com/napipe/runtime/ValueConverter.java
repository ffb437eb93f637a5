package com.napipe.runtime;

import com.napipe.data.MissingValues;
import com.napipe.types.BooleanType;
import com.napipe.types.ByteType;
import com.napipe.types.DataType;
import com.napipe.types.DoubleType;
import com.napipe.types.FloatType;
import com.napipe.types.IntegerType;
import com.napipe.types.ItemKind;
import com.napipe.types.LongType;
import com.napipe.types.ShortType;
import com.napipe.types.TimeSpanType;
import com.napipe.types.TimestampType;
import com.napipe.types.TypeCompatibility;
import com.napipe.types.TypeMapper;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Converts scalar values between item types.
 *
 * <p>Missing values stay missing. Text that cannot be parsed into the target
 * type becomes missing. Narrowing numeric conversions truncate.
 */
final class ValueConverter {

    private ValueConverter() {}

    static Object convert(Object value, DataType from, DataType to) {
        if (!TypeCompatibility.canConvert(from, to).possible()) {
            throw new IllegalArgumentException(
                "No conversion from " + TypeMapper.toRawKind(from) + " to " + TypeMapper.toRawKind(to));
        }
        if (MissingValues.isMissing(value)) {
            return null;
        }
        if (from.equals(to)) {
            return value;
        }

        if (to.itemKind() == ItemKind.TEXT) {
            return String.valueOf(value);
        }
        if (from.itemKind() == ItemKind.TEXT) {
            return parse((String) value, to);
        }
        if (value instanceof Boolean b) {
            return fromNumber(b ? 1 : 0, to);
        }
        return fromNumber((Number) value, to);
    }

    /**
     * Converts a number to the given numeric item type.
     */
    static Object fromNumber(Number number, DataType to) {
        if (to instanceof ByteType) return number.byteValue();
        if (to instanceof ShortType) return number.shortValue();
        if (to instanceof IntegerType) return number.intValue();
        if (to instanceof LongType) return number.longValue();
        if (to instanceof FloatType) return number.floatValue();
        if (to instanceof DoubleType) return number.doubleValue();
        throw new IllegalArgumentException("Not a numeric type: " + to);
    }

    private static Object parse(String text, DataType to) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            if (to instanceof BooleanType) {
                if (trimmed.equalsIgnoreCase("true")) return Boolean.TRUE;
                if (trimmed.equalsIgnoreCase("false")) return Boolean.FALSE;
                return null;
            }
            if (to instanceof TimeSpanType) return Duration.parse(trimmed);
            if (to instanceof TimestampType) return Instant.parse(trimmed);
            if (to instanceof FloatType) return Float.parseFloat(trimmed);
            if (to instanceof DoubleType) return Double.parseDouble(trimmed);
            return fromNumber(Long.parseLong(trimmed), to);
        } catch (NumberFormatException | DateTimeParseException e) {
            // Unparseable text is missing
            return null;
        }
    }
}
