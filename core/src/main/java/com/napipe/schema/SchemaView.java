package com.napipe.schema;

import com.napipe.types.ColumnTypeDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

/**
 * Read-only view of a dataset schema: an ordered list of uniquely named columns.
 *
 * <p>Planning reads schemas only through this interface, so any execution engine
 * can supply its own implementation.
 */
public interface SchemaView {

    /**
     * Returns the number of columns.
     *
     * @return the column count
     */
    int columnCount();

    /**
     * Returns the column at the given index.
     *
     * @param index the column index
     * @return the field
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    Field field(int index);

    /**
     * Looks up a column by name.
     *
     * @param name the column name
     * @return the column index, or empty if no column has that name
     */
    OptionalInt tryGetColumnIndex(String name);

    /**
     * Returns the resolved type of the column at the given index.
     *
     * @param index the column index
     * @return the type descriptor
     */
    default ColumnTypeDescriptor getColumnType(int index) {
        return ColumnTypeDescriptor.of(field(index).dataType());
    }

    /**
     * Returns the name of the column at the given index.
     *
     * @param index the column index
     * @return the column name
     */
    default String getColumnName(int index) {
        return field(index).name();
    }

    /**
     * Returns whether a column with the given name exists.
     *
     * @param name the column name
     * @return true if present
     */
    default boolean hasColumn(String name) {
        return tryGetColumnIndex(name).isPresent();
    }

    /**
     * Returns all column names in schema order.
     *
     * @return an unmodifiable list of names
     */
    default List<String> columnNames() {
        List<String> names = new ArrayList<>(columnCount());
        for (int i = 0; i < columnCount(); i++) {
            names.add(getColumnName(i));
        }
        return Collections.unmodifiableList(names);
    }
}
