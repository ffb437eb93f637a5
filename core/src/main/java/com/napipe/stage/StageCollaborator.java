package com.napipe.stage;

import com.napipe.data.DatasetView;
import com.napipe.schema.SchemaView;

import java.util.List;

/**
 * A processing stage that applies one batch of same-kind column instructions.
 *
 * <p>Binding validates the instructions against an input schema and computes the
 * output schema without touching data; applying transforms a dataset. A stage
 * writing to an existing column name replaces that column in place, and appends
 * new names at the end.
 *
 * @param <T> the instruction type
 */
public interface StageCollaborator<T> {

    /**
     * Returns the kind of this stage.
     *
     * @return the stage kind
     */
    StageKind kind();

    /**
     * Validates instructions against an input schema and computes the output schema.
     *
     * @param input the input schema
     * @param instructions the instructions, in order
     * @return the output schema
     * @throws StageException if the instructions cannot be applied to the schema
     */
    SchemaView bind(SchemaView input, List<T> instructions);

    /**
     * Applies the instructions to a dataset.
     *
     * @param input the input dataset
     * @param instructions the instructions, in order
     * @return the transformed dataset
     * @throws StageException if the transformation fails
     */
    DatasetView apply(DatasetView input, List<T> instructions);
}
