package com.napipe.schema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Immutable schema: an ordered list of uniquely named fields.
 */
public final class Schema implements SchemaView {

    /** Schema with no columns. */
    public static final Schema EMPTY = new Schema(Collections.emptyList());

    private final List<Field> fields;
    private final Map<String, Integer> indexByName;

    /**
     * Creates a schema with the given fields.
     *
     * @param fields the fields in column order
     * @throws SchemaException if two fields share a name
     */
    public Schema(List<Field> fields) {
        Objects.requireNonNull(fields, "fields must not be null");
        this.fields = List.copyOf(fields);
        this.indexByName = new HashMap<>();
        for (int i = 0; i < this.fields.size(); i++) {
            String name = this.fields.get(i).name();
            if (indexByName.putIfAbsent(name, i) != null) {
                throw new SchemaException("Duplicate column name: '" + name + "'");
            }
        }
    }

    /**
     * Creates a schema with the given fields.
     *
     * @param fields the fields in column order
     */
    public Schema(Field... fields) {
        this(Arrays.asList(fields));
    }

    /**
     * Copies any schema view into a schema.
     *
     * @param view the view to copy
     * @return the schema
     */
    public static Schema copyOf(SchemaView view) {
        if (view instanceof Schema schema) {
            return schema;
        }
        List<Field> fields = new ArrayList<>(view.columnCount());
        for (int i = 0; i < view.columnCount(); i++) {
            fields.add(view.field(i));
        }
        return new Schema(fields);
    }

    /**
     * Returns the fields in this schema.
     *
     * @return an unmodifiable list of fields
     */
    public List<Field> fields() {
        return fields;
    }

    @Override
    public int columnCount() {
        return fields.size();
    }

    @Override
    public Field field(int index) {
        return fields.get(index);
    }

    @Override
    public OptionalInt tryGetColumnIndex(String name) {
        Integer index = indexByName.get(name);
        return index == null ? OptionalInt.empty() : OptionalInt.of(index);
    }

    /**
     * Returns the field with the given name, or null if not found.
     *
     * @param name the column name
     * @return the field, or null if not found
     */
    public Field fieldByName(String name) {
        Integer index = indexByName.get(name);
        return index == null ? null : fields.get(index);
    }

    /**
     * Returns a schema where the named column is replaced in place, or appended
     * if no column has that name.
     *
     * @param field the new field
     * @return the new schema
     */
    public Schema withField(Field field) {
        List<Field> result = new ArrayList<>(fields);
        Integer index = indexByName.get(field.name());
        if (index != null) {
            result.set(index, field);
        } else {
            result.add(field);
        }
        return new Schema(result);
    }

    /**
     * Returns a schema without the named columns.
     *
     * @param names the names to remove; all must exist
     * @return the new schema
     * @throws SchemaException if a name is not present
     */
    public Schema without(List<String> names) {
        for (String name : names) {
            if (!indexByName.containsKey(name)) {
                throw new SchemaException("Column '" + name + "' does not exist");
            }
        }
        List<Field> result = new ArrayList<>(fields.size());
        for (Field field : fields) {
            if (!names.contains(field.name())) {
                result.add(field);
            }
        }
        return new Schema(result);
    }

    /**
     * Returns a schema holding only the named columns, in the given order.
     *
     * @param names the names to keep; all must exist
     * @return the new schema
     * @throws SchemaException if a name is not present
     */
    public Schema select(List<String> names) {
        List<Field> result = new ArrayList<>(names.size());
        for (String name : names) {
            Field field = fieldByName(name);
            if (field == null) {
                throw new SchemaException("Column '" + name + "' does not exist");
            }
            result.add(field);
        }
        return new Schema(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Schema that = (Schema) o;
        return Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "Schema(" + fields + ")";
    }
}
