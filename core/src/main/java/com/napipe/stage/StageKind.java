package com.napipe.stage;

/**
 * The five kinds of processing stage a composed pipeline is built from, in the
 * order they are chained.
 */
public enum StageKind {
    /** Adds boolean columns marking absent values. */
    INDICATOR("Indicator"),
    /** Re-types columns. */
    COERCER("Coercer"),
    /** Fills absent values. */
    REPLACER("Replacer"),
    /** Concatenates tagged columns into one vector column. */
    MERGER("Merger"),
    /** Removes columns. */
    DROPPER("Dropper");

    private final String displayName;

    StageKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
