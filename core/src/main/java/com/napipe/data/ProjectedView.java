package com.napipe.data;

import com.napipe.schema.Schema;

import java.util.List;

/**
 * View exposing a subset of another dataset's columns, in a chosen order,
 * without copying data.
 */
public final class ProjectedView implements DatasetView {

    private final DatasetView source;
    private final Schema schema;

    /**
     * Creates a projection.
     *
     * @param source the dataset to project
     * @param names the columns to expose; all must exist in the source
     */
    public ProjectedView(DatasetView source, List<String> names) {
        this.source = source;
        this.schema = Schema.copyOf(source.schema()).select(names);
    }

    @Override
    public Schema schema() {
        return schema;
    }

    @Override
    public int rowCount() {
        return source.rowCount();
    }

    @Override
    public List<Object> column(int index) {
        return source.column(schema.getColumnName(index));
    }
}
