package com.napipe.stage;

import com.napipe.types.DataType;
import com.napipe.types.TypeMapper;

import java.util.Objects;

/**
 * Writes column {@code source} re-typed to item type {@code resultType} into {@code name}.
 *
 * <p>Vector columns keep their shape; only the item type changes.
 */
public record CoerceColumn(String name, String source, DataType resultType) {

    public CoerceColumn {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(resultType, "resultType must not be null");
        if (resultType.isVector()) {
            throw new IllegalArgumentException("resultType must be an item type: " + resultType);
        }
    }

    @Override
    public String toString() {
        return name + " <- " + source + " as " + TypeMapper.toRawKind(resultType);
    }
}
