package com.napipe.data;

import com.napipe.schema.SchemaView;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Columnar view of a dataset.
 *
 * <p>Cell values are plain Java objects matching the column's item type. Vector
 * cells are {@code List<Object>}. A missing value is {@code null}, or NaN for
 * float and double items.
 */
public interface DatasetView {

    /**
     * Returns the schema of this dataset.
     *
     * @return the schema
     */
    SchemaView schema();

    /**
     * Returns the number of rows.
     *
     * @return the row count
     */
    int rowCount();

    /**
     * Returns the cells of one column in row order.
     *
     * @param index the column index
     * @return an unmodifiable list of cell values
     */
    List<Object> column(int index);

    /**
     * Returns the cells of the named column in row order.
     *
     * @param name the column name
     * @return an unmodifiable list of cell values
     * @throws IllegalArgumentException if no column has that name
     */
    default List<Object> column(String name) {
        OptionalInt index = schema().tryGetColumnIndex(name);
        if (index.isEmpty()) {
            throw new IllegalArgumentException("Column '" + name + "' does not exist");
        }
        return column(index.getAsInt());
    }

    /**
     * Returns one row as a list of cells in column order.
     *
     * @param row the row index
     * @return the row cells
     */
    default List<Object> row(int row) {
        List<Object> cells = new ArrayList<>(schema().columnCount());
        for (int i = 0; i < schema().columnCount(); i++) {
            cells.add(column(i).get(row));
        }
        return cells;
    }
}
