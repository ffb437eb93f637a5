package com.napipe.stage;

import java.util.List;
import java.util.Objects;

/**
 * Concatenates the tagged source columns, in order, into vector column {@code name}.
 */
public record MergeColumn(String name, List<TaggedSource> sources) {

    public MergeColumn {
        Objects.requireNonNull(name, "name must not be null");
        sources = List.copyOf(Objects.requireNonNull(sources, "sources must not be null"));
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("merge column '" + name + "' needs at least one source");
        }
    }

    @Override
    public String toString() {
        return name + " <- concat" + sources;
    }
}
