package com.napipe.stage;

import java.util.Objects;

/**
 * One part of a merged column: a source column and the tag naming its slots.
 */
public record TaggedSource(String tag, String source) {

    public TaggedSource {
        Objects.requireNonNull(tag, "tag must not be null");
        Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public String toString() {
        return tag + "=" + source;
    }
}
