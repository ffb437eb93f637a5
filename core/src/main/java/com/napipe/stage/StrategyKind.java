package com.napipe.stage;

/**
 * How absent values are replaced.
 *
 * <p>Mean, minimum and maximum are computed over present values, per slot or
 * across the whole column. They apply to numeric and temporal items only.
 */
public enum StrategyKind {
    /** The zero or empty value of the item type. */
    DEFAULT,
    MEAN,
    MINIMUM,
    MAXIMUM;

    /**
     * Returns whether this strategy needs ordered, averageable items.
     *
     * @return true for mean, minimum and maximum
     */
    public boolean requiresOrderedItems() {
        return this != DEFAULT;
    }
}
