package com.napipe.stage;

import java.util.Objects;

/**
 * Adds column {@code name} marking which values of {@code source} are absent.
 */
public record IndicatorColumn(String name, String source) {

    public IndicatorColumn {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public String toString() {
        return name + " <- isMissing(" + source + ")";
    }
}
