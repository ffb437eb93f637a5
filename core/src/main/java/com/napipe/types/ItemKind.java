package com.napipe.types;

/**
 * Coarse classification of item types.
 *
 * <p>Replacement strategies and indicator compatibility are decided per kind,
 * while coercion targets always carry the concrete item type.
 */
public enum ItemKind {
    BOOLEAN,
    NUMERIC,
    TEXT,
    TIME_SPAN,
    DATE_TIME;

    /**
     * Returns whether values of this kind are ordered and can be averaged.
     *
     * @return true for numeric and temporal kinds
     */
    public boolean isOrdered() {
        return this == NUMERIC || this == TIME_SPAN || this == DATE_TIME;
    }
}
