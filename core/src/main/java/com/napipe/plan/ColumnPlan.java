package com.napipe.plan;

import com.napipe.stage.StrategyKind;
import com.napipe.types.ColumnTypeDescriptor;

import java.util.Objects;

/**
 * Fully resolved plan for one requested column.
 *
 * <p>Without an indicator the plan is a single replacement into the output column.
 * With an indicator it also names the two temporary columns holding the raw
 * indicator and the raw replacement values, and whether the indicator needs a
 * coercion before both are merged.
 *
 * @param outputName the requested output column
 * @param sourceName the input column
 * @param sourceType the resolved type of the input column
 * @param strategy the effective replacement strategy
 * @param imputeBySlot the effective slot-imputation setting
 * @param emitIndicator whether an indicator is merged into the output
 * @param indicatorName the temporary indicator column, or null without indicator
 * @param valueName the temporary replacement column, or null without indicator
 * @param needsCoercion whether the indicator must be converted to the source item type
 */
public record ColumnPlan(
        String outputName,
        String sourceName,
        ColumnTypeDescriptor sourceType,
        StrategyKind strategy,
        boolean imputeBySlot,
        boolean emitIndicator,
        String indicatorName,
        String valueName,
        boolean needsCoercion) {

    public ColumnPlan {
        Objects.requireNonNull(outputName, "outputName must not be null");
        Objects.requireNonNull(sourceName, "sourceName must not be null");
        Objects.requireNonNull(sourceType, "sourceType must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
        if (emitIndicator) {
            Objects.requireNonNull(indicatorName, "indicatorName must not be null");
            Objects.requireNonNull(valueName, "valueName must not be null");
            if (indicatorName.equals(valueName)) {
                throw new IllegalArgumentException("temporary names must differ: " + indicatorName);
            }
        } else if (indicatorName != null || valueName != null || needsCoercion) {
            throw new IllegalArgumentException("a plan without indicator has no temporary columns");
        }
        if (imputeBySlot && sourceType.isVariableLengthVector()) {
            throw new IllegalArgumentException("variable-length vectors cannot be imputed by slot");
        }
    }

    /**
     * Plans a replacement written directly into the output column.
     */
    static ColumnPlan direct(ColumnRequest request, ColumnTypeDescriptor sourceType,
                             StrategyKind strategy, boolean imputeBySlot) {
        return new ColumnPlan(request.outputName(), request.sourceName(), sourceType,
            strategy, imputeBySlot, false, null, null, false);
    }

    /**
     * Plans a replacement merged with an indicator through two temporary columns.
     */
    static ColumnPlan withIndicator(ColumnRequest request, ColumnTypeDescriptor sourceType,
                                    StrategyKind strategy, boolean imputeBySlot,
                                    String indicatorName, String valueName, boolean needsCoercion) {
        return new ColumnPlan(request.outputName(), request.sourceName(), sourceType,
            strategy, imputeBySlot, true, indicatorName, valueName, needsCoercion);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ColumnPlan(")
            .append(outputName).append(" <- ").append(sourceName)
            .append(", ").append(strategy)
            .append(imputeBySlot ? ", bySlot" : ", wholeColumn");
        if (emitIndicator) {
            sb.append(", indicator=").append(indicatorName)
              .append(", value=").append(valueName);
            if (needsCoercion) {
                sb.append(", coerce");
            }
        }
        return sb.append(")").toString();
    }
}
