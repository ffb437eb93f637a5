package com.napipe.runtime;

import com.napipe.data.MissingValues;
import com.napipe.stage.StrategyKind;
import com.napipe.types.DataType;
import com.napipe.types.DoubleType;
import com.napipe.types.FloatType;
import com.napipe.types.TimeSpanType;
import com.napipe.types.TimestampType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;

/**
 * Computes the value that replaces absent items, from the present items of a
 * slot or of a whole column.
 *
 * <p>When no item is present the default value of the item type is used.
 */
final class ReplacementValues {

    private static final BigInteger NANOS_PER_SECOND = BigInteger.valueOf(1_000_000_000L);

    private ReplacementValues() {}

    static Object compute(StrategyKind strategy, DataType itemType, Collection<?> items) {
        if (strategy == StrategyKind.DEFAULT) {
            return MissingValues.defaultValue(itemType);
        }
        if (!itemType.itemKind().isOrdered()) {
            throw new IllegalArgumentException(strategy + " is not defined for item type " + itemType);
        }

        long count = items.stream().filter(v -> !MissingValues.isMissing(v)).count();
        if (count == 0) {
            return MissingValues.defaultValue(itemType);
        }

        return switch (strategy) {
            case MINIMUM -> extreme(items, -1);
            case MAXIMUM -> extreme(items, 1);
            case MEAN -> mean(itemType, items, count);
            case DEFAULT -> MissingValues.defaultValue(itemType);
        };
    }

    /**
     * Returns the smallest (direction -1) or largest (direction 1) present item.
     */
    private static Object extreme(Collection<?> items, int direction) {
        Object best = null;
        for (Object item : items) {
            if (MissingValues.isMissing(item)) {
                continue;
            }
            if (best == null || Integer.signum(compare(item, best)) == direction) {
                best = item;
            }
        }
        return best;
    }

    @SuppressWarnings("unchecked")
    private static int compare(Object left, Object right) {
        return ((Comparable<Object>) left).compareTo(right);
    }

    /**
     * Floating-point means are computed in double precision. Integral and temporal
     * means are computed exactly over whole units (nanoseconds for temporal items)
     * and rounded half up.
     */
    private static Object mean(DataType itemType, Collection<?> items, long count) {
        if (isFloatingPoint(itemType)) {
            double sum = 0;
            for (Object item : items) {
                if (!MissingValues.isMissing(item)) {
                    sum += ((Number) item).doubleValue();
                }
            }
            return ValueConverter.fromNumber(sum / count, itemType);
        }

        BigInteger sum = BigInteger.ZERO;
        for (Object item : items) {
            if (!MissingValues.isMissing(item)) {
                sum = sum.add(units(item));
            }
        }
        BigInteger mean = new BigDecimal(sum)
            .divide(BigDecimal.valueOf(count), 0, RoundingMode.HALF_UP)
            .toBigInteger();

        if (itemType instanceof TimeSpanType) {
            BigInteger[] parts = mean.divideAndRemainder(NANOS_PER_SECOND);
            return Duration.ofSeconds(parts[0].longValueExact(), parts[1].longValue());
        }
        if (itemType instanceof TimestampType) {
            BigInteger[] parts = mean.divideAndRemainder(NANOS_PER_SECOND);
            return Instant.ofEpochSecond(parts[0].longValueExact(), parts[1].longValue());
        }
        return ValueConverter.fromNumber(mean.longValueExact(), itemType);
    }

    private static BigInteger units(Object item) {
        if (item instanceof Duration d) {
            return BigInteger.valueOf(d.getSeconds()).multiply(NANOS_PER_SECOND).add(BigInteger.valueOf(d.getNano()));
        }
        if (item instanceof Instant i) {
            return BigInteger.valueOf(i.getEpochSecond()).multiply(NANOS_PER_SECOND).add(BigInteger.valueOf(i.getNano()));
        }
        return BigInteger.valueOf(((Number) item).longValue());
    }

    private static boolean isFloatingPoint(DataType itemType) {
        return itemType instanceof FloatType || itemType instanceof DoubleType;
    }
}
