package com.napipe.plan;

import com.napipe.data.DatasetView;
import com.napipe.exception.InternalInvariantException;
import com.napipe.plan.ComposedPipeline.BoundStage;
import com.napipe.schema.Field;
import com.napipe.schema.Schema;
import com.napipe.schema.SchemaView;
import com.napipe.stage.CoerceColumn;
import com.napipe.stage.IndicatorColumn;
import com.napipe.stage.MergeColumn;
import com.napipe.stage.ReplaceColumn;
import com.napipe.stage.StageCollaborator;
import com.napipe.stage.StageCollaborators;
import com.napipe.stage.StageKind;
import com.napipe.stage.TaggedSource;
import com.napipe.types.ColumnTypeDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Merges per-column plans into one {@link ComposedPipeline}.
 *
 * <p>Instructions are routed into five groups, each in request order:
 * <pre>
 *   no indicator:  Replacer  source → output
 *   indicator:     Indicator source → tmpIndicator
 *                  Coercer   tmpIndicator → tmpIndicator (only if needed)
 *                  Replacer  source → tmpValue
 *                  Merger    [tmpValue, tmpIndicator] → output
 *                  Dropper   tmpIndicator, tmpValue
 * </pre>
 * Empty groups are omitted. Every remaining group is bound once against the output
 * schema of the previous one, and the resulting schema is checked against the
 * requested outputs before the pipeline is returned.
 */
public class PipelineAssembler {

    private static final Logger logger = LoggerFactory.getLogger(PipelineAssembler.class);

    /** Tag of the indicator part of a merged vector column */
    static final String INDICATOR_TAG = "IsMissing";

    private final StageCollaborators collaborators;

    /**
     * Creates an assembler instantiating stages with the given collaborators.
     *
     * @param collaborators one collaborator per stage kind
     */
    public PipelineAssembler(StageCollaborators collaborators) {
        this.collaborators = Objects.requireNonNull(collaborators, "collaborators must not be null");
    }

    /**
     * Assembles plans against an input dataset's schema.
     *
     * @param plans the plans in request order
     * @param input the input dataset
     * @return the composed pipeline
     */
    public ComposedPipeline assemble(List<ColumnPlan> plans, DatasetView input) {
        return assemble(plans, input.schema());
    }

    /**
     * Assembles plans against an input schema.
     *
     * @param plans the plans in request order
     * @param inputSchema the input schema
     * @return the composed pipeline
     * @throws com.napipe.stage.StageException if a collaborator rejects its instructions
     * @throws InternalInvariantException if the result does not match the requested outputs
     */
    public ComposedPipeline assemble(List<ColumnPlan> plans, SchemaView inputSchema) {
        Objects.requireNonNull(plans, "plans must not be null");
        Objects.requireNonNull(inputSchema, "inputSchema must not be null");
        if (plans.isEmpty()) {
            throw new IllegalArgumentException("plans must not be empty");
        }

        StageGroup.Builder<IndicatorColumn> indicators = StageGroup.builder(StageKind.INDICATOR);
        StageGroup.Builder<CoerceColumn> coercions = StageGroup.builder(StageKind.COERCER);
        StageGroup.Builder<ReplaceColumn> replacements = StageGroup.builder(StageKind.REPLACER);
        StageGroup.Builder<MergeColumn> merges = StageGroup.builder(StageKind.MERGER);
        StageGroup.Builder<String> drops = StageGroup.builder(StageKind.DROPPER);

        List<String> outputNames = new ArrayList<>(plans.size());
        for (ColumnPlan plan : plans) {
            outputNames.add(plan.outputName());

            if (!plan.emitIndicator()) {
                replacements.add(new ReplaceColumn(
                    plan.outputName(), plan.sourceName(), plan.strategy(), plan.imputeBySlot()));
                continue;
            }

            indicators.add(new IndicatorColumn(plan.indicatorName(), plan.sourceName()));
            if (plan.needsCoercion()) {
                coercions.add(new CoerceColumn(
                    plan.indicatorName(), plan.indicatorName(), plan.sourceType().itemType()));
            }
            replacements.add(new ReplaceColumn(
                plan.valueName(), plan.sourceName(), plan.strategy(), plan.imputeBySlot()));
            merges.add(new MergeColumn(plan.outputName(), mergeParts(plan)));
            drops.add(plan.indicatorName());
            drops.add(plan.valueName());
        }

        List<BoundStage<?>> stages = new ArrayList<>(StageKind.values().length);
        addIfNotEmpty(stages, indicators.build(), collaborators.indicator());
        addIfNotEmpty(stages, coercions.build(), collaborators.coercer());
        addIfNotEmpty(stages, replacements.build(), collaborators.replacer());
        addIfNotEmpty(stages, merges.build(), collaborators.merger());
        addIfNotEmpty(stages, drops.build(), collaborators.dropper());

        SchemaView schema = inputSchema;
        for (BoundStage<?> stage : stages) {
            schema = stage.bind(schema);
            logger.debug("Bound {} stage with {} instruction(s), columns now {}",
                stage.group().kind().displayName(), stage.group().instructions().size(), schema.columnNames());
        }

        Schema outputSchema = verifyOutput(plans, Schema.copyOf(schema));
        return new ComposedPipeline(Schema.copyOf(inputSchema), stages, outputNames, outputSchema);
    }

    /**
     * Names the value and indicator parts of a merged column.
     *
     * <p>For a vector source the value slots are tagged with the source name and the
     * indicator slots with {@code IsMissing}; for a scalar source the two slots are
     * the source name and {@code IsMissing.<source>}.
     */
    private static List<TaggedSource> mergeParts(ColumnPlan plan) {
        String source = plan.sourceName();
        String indicatorTag = plan.sourceType().isVector() ? INDICATOR_TAG : INDICATOR_TAG + "." + source;
        return List.of(
            new TaggedSource(source, plan.valueName()),
            new TaggedSource(indicatorTag, plan.indicatorName()));
    }

    private static <T> void addIfNotEmpty(List<BoundStage<?>> stages, StageGroup<T> group,
                                          StageCollaborator<T> collaborator) {
        if (!group.isEmpty()) {
            stages.add(new BoundStage<>(group, collaborator));
        }
    }

    /**
     * Checks the final schema: every requested output is present with the expected
     * shape and no temporary column survives. Returns the projection onto the
     * requested outputs.
     */
    private static Schema verifyOutput(List<ColumnPlan> plans, Schema finalSchema) {
        List<String> outputNames = new ArrayList<>(plans.size());
        for (ColumnPlan plan : plans) {
            if (plan.emitIndicator()) {
                for (String temp : List.of(plan.indicatorName(), plan.valueName())) {
                    if (finalSchema.hasColumn(temp)) {
                        throw new InternalInvariantException("Temporary column '" + temp + "' survived assembly");
                    }
                }
            }

            Field field = finalSchema.fieldByName(plan.outputName());
            if (field == null) {
                throw new InternalInvariantException("Requested column '" + plan.outputName() + "' missing after assembly");
            }
            ColumnTypeDescriptor type = ColumnTypeDescriptor.of(field.dataType());
            boolean shapeMatches = plan.emitIndicator()
                ? type.isVector() && type.itemType().equals(plan.sourceType().itemType())
                : type.equals(plan.sourceType());
            if (!shapeMatches) {
                throw new InternalInvariantException("Requested column '" + plan.outputName()
                    + "' has unexpected type " + field.dataType() + " after assembly");
            }
            outputNames.add(plan.outputName());
        }

        Schema projected = finalSchema.select(outputNames);
        if (!projected.columnNames().equals(outputNames)) {
            throw new InternalInvariantException("Output columns " + projected.columnNames()
                + " do not match requested " + outputNames);
        }
        return projected;
    }
}
