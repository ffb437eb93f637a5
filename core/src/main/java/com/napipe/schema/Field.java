package com.napipe.schema;

import com.napipe.types.DataType;
import com.napipe.types.VectorType;

import java.util.List;
import java.util.Objects;

/**
 * Represents a column in a {@link Schema}.
 *
 * <p>Each field has a name, a data type, and optional slot names. Slot names
 * label the positions of a known-length vector column; when present there is
 * exactly one per slot.
 */
public record Field(String name, DataType dataType, List<String> slotNames) {

    /**
     * Creates a field.
     *
     * @param name the column name
     * @param dataType the column type
     * @param slotNames the slot names, or an empty list
     */
    public Field {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(dataType, "dataType must not be null");
        slotNames = slotNames == null ? List.of() : List.copyOf(slotNames);
        if (name.isEmpty()) {
            throw new IllegalArgumentException("column name must not be empty");
        }
        if (!slotNames.isEmpty()) {
            if (!(dataType instanceof VectorType vector) || vector.size() != slotNames.size()) {
                throw new IllegalArgumentException(
                    "slot names of column '" + name + "' do not match its type " + dataType);
            }
        }
    }

    /**
     * Creates a field without slot names.
     *
     * @param name the column name
     * @param dataType the column type
     */
    public Field(String name, DataType dataType) {
        this(name, dataType, List.of());
    }

    @Override
    public String toString() {
        return name + ": " + dataType;
    }
}
