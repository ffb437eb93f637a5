package com.napipe.plan;

import com.napipe.stage.StrategyKind;

import java.util.Objects;

/**
 * One requested column: fill absent values of {@code sourceName} into {@code outputName}.
 *
 * <p>Unset ({@code null}) settings fall back to the {@link PipelineDefaults} of
 * the composition.
 *
 * @param outputName the output column; unique within one composition
 * @param sourceName the input column
 * @param strategy the replacement strategy, or null for the pipeline default
 * @param imputeBySlot whether to impute per slot, or null to decide from the column shape
 * @param emitIndicator whether to merge an indicator into the output, or null for the pipeline default
 */
public record ColumnRequest(
        String outputName,
        String sourceName,
        StrategyKind strategy,
        Boolean imputeBySlot,
        Boolean emitIndicator) {

    public ColumnRequest {
        Objects.requireNonNull(outputName, "outputName must not be null");
        Objects.requireNonNull(sourceName, "sourceName must not be null");
        if (outputName.isEmpty() || sourceName.isEmpty()) {
            throw new IllegalArgumentException("column names must not be empty");
        }
    }

    /**
     * Requests in-place handling of one column with all settings unset.
     *
     * @param name the column name, used as both source and output
     * @return the request
     */
    public static ColumnRequest of(String name) {
        return new ColumnRequest(name, name, null, null, null);
    }

    /**
     * Requests handling of a column into a new output column with all settings unset.
     *
     * @param outputName the output column
     * @param sourceName the input column
     * @return the request
     */
    public static ColumnRequest of(String outputName, String sourceName) {
        return new ColumnRequest(outputName, sourceName, null, null, null);
    }

    public ColumnRequest withStrategy(StrategyKind newStrategy) {
        return new ColumnRequest(outputName, sourceName, newStrategy, imputeBySlot, emitIndicator);
    }

    public ColumnRequest withImputeBySlot(Boolean newImputeBySlot) {
        return new ColumnRequest(outputName, sourceName, strategy, newImputeBySlot, emitIndicator);
    }

    public ColumnRequest withEmitIndicator(Boolean newEmitIndicator) {
        return new ColumnRequest(outputName, sourceName, strategy, imputeBySlot, newEmitIndicator);
    }
}
