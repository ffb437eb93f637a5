package com.napipe.types;

/**
 * Data type representing an elapsed amount of time.
 * Values are {@link java.time.Duration}.
 */
public final class TimeSpanType implements DataType {

    private static final TimeSpanType INSTANCE = new TimeSpanType();

    private TimeSpanType() {}

    public static TimeSpanType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "timespan";
    }

    @Override
    public ItemKind itemKind() {
        return ItemKind.TIME_SPAN;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof TimeSpanType;
    }

    @Override
    public int hashCode() {
        return typeName().hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
