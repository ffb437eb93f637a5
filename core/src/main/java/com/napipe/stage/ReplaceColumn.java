package com.napipe.stage;

import java.util.Objects;

/**
 * Writes column {@code source} with absent values filled into {@code name}.
 *
 * @param name the output column
 * @param source the input column
 * @param strategy how replacement values are computed
 * @param imputeBySlot compute one replacement value per vector slot instead of one for the whole column
 */
public record ReplaceColumn(String name, String source, StrategyKind strategy, boolean imputeBySlot) {

    public ReplaceColumn {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
    }

    @Override
    public String toString() {
        return name + " <- replace(" + source + ", " + strategy + (imputeBySlot ? ", bySlot" : "") + ")";
    }
}
