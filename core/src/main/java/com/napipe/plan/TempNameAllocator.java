package com.napipe.plan;

import com.napipe.schema.SchemaView;

import java.util.List;

/**
 * Produces names for temporary columns that collide with nothing.
 *
 * <p>An allocator instance is scoped to one composition. Names it returns never
 * collide with columns of the given schema, with each other, or with any name the
 * same instance returned before.
 */
public interface TempNameAllocator {

    /**
     * Allocates {@code count} distinct names derived from {@code baseLabel}.
     *
     * @param baseLabel the label the names are derived from
     * @param count the number of names
     * @param existingSchema the schema whose column names must be avoided
     * @return the names, in allocation order
     */
    List<String> allocate(String baseLabel, int count, SchemaView existingSchema);
}
