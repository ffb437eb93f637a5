package com.napipe.runtime;

import com.napipe.data.DatasetView;
import com.napipe.data.InMemoryDataset;
import com.napipe.schema.Schema;
import com.napipe.schema.SchemaException;
import com.napipe.schema.SchemaView;
import com.napipe.stage.StageCollaborator;
import com.napipe.stage.StageException;
import com.napipe.stage.StageKind;

import java.util.List;

/**
 * Removes columns by name. Every name must exist.
 */
public class DropperStage implements StageCollaborator<String> {

    @Override
    public StageKind kind() {
        return StageKind.DROPPER;
    }

    @Override
    public SchemaView bind(SchemaView input, List<String> names) {
        try {
            return Schema.copyOf(input).without(names);
        } catch (SchemaException e) {
            throw new StageException(kind(), e.getMessage(), e);
        }
    }

    @Override
    public DatasetView apply(DatasetView input, List<String> names) {
        try {
            return InMemoryDataset.copyOf(input).without(names);
        } catch (SchemaException e) {
            throw new StageException(kind(), e.getMessage(), e);
        }
    }
}
