package com.napipe.plan;

import com.napipe.data.DatasetView;
import com.napipe.data.ProjectedView;
import com.napipe.schema.Schema;
import com.napipe.schema.SchemaView;
import com.napipe.stage.StageCollaborator;
import com.napipe.stage.StageKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Executable result of a composition: up to five stage groups chained in the order
 * Indicator, Coercer, Replacer, Merger, Dropper, followed by a projection onto the
 * requested output columns in request order.
 *
 * <p>The output schema is known without touching data. Two pipelines are equal when
 * they were composed against the same input schema into the same groups,
 * instructions and outputs.
 */
public final class ComposedPipeline {

    private final Schema inputSchema;
    private final List<BoundStage<?>> stages;
    private final List<String> outputNames;
    private final Schema outputSchema;

    ComposedPipeline(Schema inputSchema, List<BoundStage<?>> stages, List<String> outputNames, Schema outputSchema) {
        this.inputSchema = Objects.requireNonNull(inputSchema, "inputSchema must not be null");
        this.stages = List.copyOf(stages);
        this.outputNames = List.copyOf(outputNames);
        this.outputSchema = Objects.requireNonNull(outputSchema, "outputSchema must not be null");
    }

    /**
     * Runs the pipeline over a dataset with the schema it was composed against.
     *
     * @param input the input dataset
     * @return a dataset holding exactly the requested output columns
     * @throws IllegalArgumentException if the input schema differs from the composed one
     */
    public DatasetView apply(DatasetView input) {
        Objects.requireNonNull(input, "input must not be null");
        if (!Schema.copyOf(input.schema()).equals(inputSchema)) {
            throw new IllegalArgumentException("Pipeline was composed for " + inputSchema
                + " but applied to " + input.schema());
        }
        DatasetView current = input;
        for (BoundStage<?> stage : stages) {
            current = stage.apply(current);
        }
        return new ProjectedView(current, outputNames);
    }

    /**
     * Returns the schema {@link #apply} produces.
     *
     * @return the output schema
     */
    public SchemaView outputSchema() {
        return outputSchema;
    }

    /**
     * Returns the schema the pipeline was composed against.
     *
     * @return the input schema
     */
    public SchemaView inputSchema() {
        return inputSchema;
    }

    /**
     * Returns the requested output names in request order.
     *
     * @return an unmodifiable list
     */
    public List<String> outputNames() {
        return outputNames;
    }

    /**
     * Returns the non-empty stage groups in execution order.
     *
     * @return an unmodifiable list
     */
    public List<StageGroup<?>> stages() {
        List<StageGroup<?>> groups = new ArrayList<>(stages.size());
        for (BoundStage<?> stage : stages) {
            groups.add(stage.group());
        }
        return Collections.unmodifiableList(groups);
    }

    /**
     * Returns the kinds of the stage groups in execution order.
     *
     * @return an unmodifiable list
     */
    public List<StageKind> stageKinds() {
        List<StageKind> kinds = new ArrayList<>(stages.size());
        for (BoundStage<?> stage : stages) {
            kinds.add(stage.group().kind());
        }
        return Collections.unmodifiableList(kinds);
    }

    /**
     * Returns the group of the given kind, or null if the pipeline has none.
     *
     * @param kind the stage kind
     * @return the group, or null
     */
    public StageGroup<?> stage(StageKind kind) {
        for (BoundStage<?> stage : stages) {
            if (stage.group().kind() == kind) {
                return stage.group();
            }
        }
        return null;
    }

    /**
     * Returns a readable description of the pipeline, one line per instruction.
     *
     * @return the description
     */
    public String explain() {
        StringBuilder sb = new StringBuilder("ComposedPipeline\n");
        sb.append("  Input ").append(inputSchema.fields()).append('\n');
        for (BoundStage<?> stage : stages) {
            sb.append("  ").append(stage.group().kind().displayName()).append('\n');
            for (Object instruction : stage.group().instructions()) {
                sb.append("    ").append(instruction).append('\n');
            }
        }
        sb.append("  Output ").append(outputSchema.fields());
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ComposedPipeline that)) return false;
        return inputSchema.equals(that.inputSchema)
            && stages().equals(that.stages())
            && outputNames.equals(that.outputNames);
    }

    @Override
    public int hashCode() {
        return Objects.hash(inputSchema, stages(), outputNames);
    }

    @Override
    public String toString() {
        return "ComposedPipeline(" + stageKinds() + " -> " + outputNames + ")";
    }

    /**
     * A stage group instantiated with its collaborator.
     */
    record BoundStage<T>(StageGroup<T> group, StageCollaborator<T> collaborator) {

        DatasetView apply(DatasetView input) {
            return collaborator.apply(input, group.instructions());
        }

        SchemaView bind(SchemaView input) {
            return collaborator.bind(input, group.instructions());
        }
    }
}
