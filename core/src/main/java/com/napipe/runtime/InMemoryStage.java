package com.napipe.runtime;

import com.napipe.data.DatasetView;
import com.napipe.data.InMemoryDataset;
import com.napipe.schema.Field;
import com.napipe.schema.Schema;
import com.napipe.schema.SchemaView;
import com.napipe.stage.StageCollaborator;
import com.napipe.stage.StageException;
import com.napipe.stage.StageKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.OptionalInt;

/**
 * Base class for the in-memory stage collaborators.
 *
 * <p>Every instruction reads its sources from the stage's input and writes one
 * output column. Subclasses describe the output column and compute its cells.
 *
 * @param <T> the instruction type
 */
abstract class InMemoryStage<T> implements StageCollaborator<T> {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final StageKind kind;

    protected InMemoryStage(StageKind kind) {
        this.kind = kind;
    }

    @Override
    public StageKind kind() {
        return kind;
    }

    @Override
    public SchemaView bind(SchemaView input, List<T> instructions) {
        Schema output = Schema.copyOf(input);
        for (T instruction : instructions) {
            output = output.withField(outputField(input, instruction));
        }
        return output;
    }

    @Override
    public DatasetView apply(DatasetView input, List<T> instructions) {
        InMemoryDataset source = InMemoryDataset.copyOf(input);
        InMemoryDataset output = source;
        for (T instruction : instructions) {
            Field field = outputField(source.schema(), instruction);
            output = output.withColumn(field, computeCells(source, instruction, field));
        }
        logger.debug("{} stage applied {} instruction(s) to {} row(s)",
            kind.displayName(), instructions.size(), source.rowCount());
        return output;
    }

    /**
     * Describes the column an instruction writes.
     *
     * @param input the stage input schema
     * @param instruction the instruction
     * @return the output field
     * @throws StageException if the instruction does not fit the schema
     */
    protected abstract Field outputField(SchemaView input, T instruction);

    /**
     * Computes the cells of the column an instruction writes.
     *
     * @param input the stage input
     * @param instruction the instruction
     * @param output the output field, as returned by {@link #outputField}
     * @return the cells in row order
     */
    protected abstract List<Object> computeCells(InMemoryDataset input, T instruction, Field output);

    protected Field sourceField(SchemaView input, String source) {
        OptionalInt index = input.tryGetColumnIndex(source);
        if (index.isEmpty()) {
            throw new StageException(kind, "source column '" + source + "' does not exist");
        }
        return input.field(index.getAsInt());
    }
}
