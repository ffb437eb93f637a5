package com.napipe.data;

import com.napipe.schema.Field;
import com.napipe.schema.Schema;
import com.napipe.schema.SchemaException;
import com.napipe.types.DataType;
import com.napipe.types.VectorType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Immutable dataset held in memory, one list of cells per column.
 *
 * <p>Cells are validated against the column types on construction. Vector cells
 * must be non-null lists; known-length vector cells must have exactly the
 * declared length.
 */
public final class InMemoryDataset implements DatasetView {

    private final Schema schema;
    private final List<List<Object>> columns;
    private final int rowCount;

    /**
     * Creates a dataset from columnar data.
     *
     * @param schema the schema
     * @param columns one list of cells per schema column
     * @throws SchemaException if the data does not fit the schema
     */
    public InMemoryDataset(Schema schema, List<List<Object>> columns) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(columns, "columns must not be null");
        if (columns.size() != schema.columnCount()) {
            throw new SchemaException("Expected " + schema.columnCount() + " columns but got " + columns.size());
        }
        this.rowCount = columns.isEmpty() ? 0 : columns.get(0).size();

        List<List<Object>> copies = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            List<Object> cells = columns.get(i);
            Field field = schema.field(i);
            if (cells.size() != rowCount) {
                throw new SchemaException("Column '" + field.name() + "' has " + cells.size()
                    + " rows, expected " + rowCount);
            }
            for (Object cell : cells) {
                validateCell(field, cell);
            }
            copies.add(Collections.unmodifiableList(new ArrayList<>(cells)));
        }
        this.columns = Collections.unmodifiableList(copies);
    }

    /**
     * Starts building a dataset row by row.
     *
     * @param schema the schema
     * @return a builder
     */
    public static Builder builder(Schema schema) {
        return new Builder(schema);
    }

    /**
     * Copies any dataset view into memory.
     *
     * @param view the view to copy
     * @return the in-memory dataset
     */
    public static InMemoryDataset copyOf(DatasetView view) {
        if (view instanceof InMemoryDataset dataset) {
            return dataset;
        }
        List<List<Object>> columns = new ArrayList<>();
        for (int i = 0; i < view.schema().columnCount(); i++) {
            columns.add(view.column(i));
        }
        return new InMemoryDataset(Schema.copyOf(view.schema()), columns);
    }

    @Override
    public Schema schema() {
        return schema;
    }

    @Override
    public int rowCount() {
        return rowCount;
    }

    @Override
    public List<Object> column(int index) {
        return columns.get(index);
    }

    /**
     * Returns a dataset where the named column is replaced in place, or appended.
     *
     * @param field the column definition
     * @param cells the column cells
     * @return the new dataset
     */
    public InMemoryDataset withColumn(Field field, List<Object> cells) {
        Schema newSchema = schema.withField(field);
        List<List<Object>> newColumns = new ArrayList<>(columns);
        OptionalInt existing = schema.tryGetColumnIndex(field.name());
        if (existing.isPresent()) {
            newColumns.set(existing.getAsInt(), cells);
        } else {
            newColumns.add(cells);
        }
        return new InMemoryDataset(newSchema, newColumns);
    }

    /**
     * Returns a dataset without the named columns.
     *
     * @param names the names to remove
     * @return the new dataset
     */
    public InMemoryDataset without(List<String> names) {
        return select(schema.without(names).columnNames());
    }

    /**
     * Returns a dataset holding only the named columns, in the given order.
     *
     * @param names the names to keep
     * @return the new dataset
     */
    public InMemoryDataset select(List<String> names) {
        Schema newSchema = schema.select(names);
        List<List<Object>> newColumns = new ArrayList<>(names.size());
        for (String name : names) {
            newColumns.add(column(name));
        }
        return new InMemoryDataset(newSchema, newColumns);
    }

    private static void validateCell(Field field, Object cell) {
        DataType type = field.dataType();
        if (type instanceof VectorType vector) {
            if (!(cell instanceof List<?> items)) {
                throw new SchemaException("Column '" + field.name() + "' expects a list value but got " + cell);
            }
            if (vector.isKnownSize() && items.size() != vector.size()) {
                throw new SchemaException("Column '" + field.name() + "' expects vectors of length "
                    + vector.size() + " but got " + items.size());
            }
            for (Object item : items) {
                validateScalar(field, vector.elementType(), item);
            }
        } else {
            validateScalar(field, type, cell);
        }
    }

    private static void validateScalar(Field field, DataType itemType, Object value) {
        if (value != null && !MissingValues.isInstance(itemType, value)) {
            throw new SchemaException("Column '" + field.name() + "' of type " + field.dataType()
                + " cannot hold value " + value + " (" + value.getClass().getSimpleName() + ")");
        }
    }

    @Override
    public String toString() {
        return "InMemoryDataset(" + schema.columnNames() + ", rows=" + rowCount + ")";
    }

    /**
     * Row-oriented builder for {@link InMemoryDataset}.
     */
    public static final class Builder {

        private final Schema schema;
        private final List<List<Object>> columns;

        private Builder(Schema schema) {
            this.schema = Objects.requireNonNull(schema, "schema must not be null");
            this.columns = new ArrayList<>();
            for (int i = 0; i < schema.columnCount(); i++) {
                columns.add(new ArrayList<>());
            }
        }

        /**
         * Appends a row.
         *
         * @param cells one cell per column
         * @return this builder
         */
        public Builder addRow(Object... cells) {
            if (cells.length != schema.columnCount()) {
                throw new SchemaException("Expected " + schema.columnCount() + " cells but got " + cells.length);
            }
            for (int i = 0; i < cells.length; i++) {
                columns.get(i).add(cells[i]);
            }
            return this;
        }

        public InMemoryDataset build() {
            return new InMemoryDataset(schema, columns);
        }
    }
}
