package com.napipe.plan;

import com.napipe.schema.SchemaView;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Allocates names of the form {@code temp_<label>_<NNN>} with a per-label counter.
 *
 * <p>Candidates taken by the schema, by a reserved name, or by an earlier
 * allocation are skipped. The same sequence of calls always yields the same names.
 */
public class SequentialTempNameAllocator implements TempNameAllocator {

    private final Set<String> taken;
    private final Map<String, Integer> nextIndexByLabel = new HashMap<>();

    /**
     * Creates an allocator that also avoids the given names.
     *
     * @param reserved names no temporary column may take
     */
    public SequentialTempNameAllocator(Collection<String> reserved) {
        this.taken = new HashSet<>(Objects.requireNonNull(reserved, "reserved must not be null"));
    }

    public SequentialTempNameAllocator() {
        this(List.of());
    }

    @Override
    public synchronized List<String> allocate(String baseLabel, int count, SchemaView existingSchema) {
        Objects.requireNonNull(existingSchema, "existingSchema must not be null");
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative: " + count);
        }
        String label = baseLabel == null ? "" : baseLabel.trim();

        List<String> names = new ArrayList<>(count);
        int index = nextIndexByLabel.getOrDefault(label, 0);
        while (names.size() < count) {
            String candidate = label.isEmpty()
                ? String.format("temp_%03d", index)
                : String.format("temp_%s_%03d", label, index);
            index++;
            if (!existingSchema.hasColumn(candidate) && taken.add(candidate)) {
                names.add(candidate);
            }
        }
        nextIndexByLabel.put(label, index);
        return List.copyOf(names);
    }
}
