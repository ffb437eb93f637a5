package com.napipe.plan;

import com.napipe.exception.ConfigurationException;
import com.napipe.exception.ConfigurationException.Reason;
import com.napipe.schema.SchemaView;
import com.napipe.stage.StrategyKind;
import com.napipe.types.BooleanType;
import com.napipe.types.ColumnTypeDescriptor;
import com.napipe.types.TypeCompatibility;
import com.napipe.types.TypeMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Resolves one {@link ColumnRequest} into a {@link ColumnPlan}.
 *
 * <p>The planner enforces only what it can verify from the schema: the source
 * column exists, slot imputation is possible for the column shape, and an
 * indicator can be represented in the column's item type. Whether a strategy suits
 * the item type is left to the replacement stage.
 *
 * <p>Temporary names are allocated last, so a failed request never consumes any.
 */
public class ColumnPlanner {

    private static final Logger logger = LoggerFactory.getLogger(ColumnPlanner.class);

    /** Label of temporary indicator columns */
    static final String INDICATOR_LABEL = "IsMissing";

    /** Label of temporary replacement columns */
    static final String VALUE_LABEL = "Replace";

    private final TempNameAllocator allocator;

    /**
     * Creates a planner drawing temporary names from the given allocator.
     *
     * @param allocator the allocator scoped to the current composition
     */
    public ColumnPlanner(TempNameAllocator allocator) {
        this.allocator = Objects.requireNonNull(allocator, "allocator must not be null");
    }

    /**
     * Plans one requested column.
     *
     * @param request the request
     * @param defaults the pipeline-wide fallbacks
     * @param schema the input schema
     * @return the resolved plan
     * @throws ConfigurationException if the request cannot be planned
     */
    public ColumnPlan plan(ColumnRequest request, PipelineDefaults defaults, SchemaView schema) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(defaults, "defaults must not be null");
        Objects.requireNonNull(schema, "schema must not be null");

        OptionalInt sourceIndex = schema.tryGetColumnIndex(request.sourceName());
        if (sourceIndex.isEmpty()) {
            throw new ConfigurationException(Reason.UNKNOWN_SOURCE_COLUMN, request.sourceName(),
                "Column '" + request.sourceName() + "' does not exist");
        }
        ColumnTypeDescriptor sourceType = schema.getColumnType(sourceIndex.getAsInt());

        StrategyKind strategy = request.strategy() != null ? request.strategy() : defaults.strategy();
        boolean imputeBySlot = resolveImputeBySlot(request, defaults, sourceType);
        boolean emitIndicator = request.emitIndicator() != null ? request.emitIndicator() : defaults.emitIndicator();

        if (strategy.requiresOrderedItems() && !sourceType.itemType().itemKind().isOrdered()) {
            logger.debug("Column '{}': {} on item type {} left for the replacement stage to validate",
                request.sourceName(), strategy, TypeMapper.toRawKind(sourceType.itemType()));
        }

        if (!emitIndicator) {
            ColumnPlan plan = ColumnPlan.direct(request, sourceType, strategy, imputeBySlot);
            logger.debug("Planned {}", plan);
            return plan;
        }

        TypeCompatibility.Conversion conversion =
            TypeCompatibility.canRepresent(BooleanType.get(), sourceType.itemType());
        if (!conversion.possible()) {
            throw new ConfigurationException(Reason.INCOMPATIBLE_INDICATOR_TYPE, request.sourceName(),
                String.format("Cannot concatenate indicator column of type '%s' to input column '%s' of type '%s'",
                    TypeMapper.toRawKind(BooleanType.get()), request.sourceName(),
                    TypeMapper.toRawKind(sourceType.itemType())));
        }

        String indicatorName = allocator.allocate(INDICATOR_LABEL, 1, schema).get(0);
        String valueName = allocator.allocate(VALUE_LABEL, 1, schema).get(0);

        ColumnPlan plan = ColumnPlan.withIndicator(request, sourceType, strategy, imputeBySlot,
            indicatorName, valueName, !conversion.isIdentity());
        logger.debug("Planned {}", plan);
        return plan;
    }

    /**
     * Resolves the slot-imputation setting.
     *
     * <p>An explicit request for slot imputation on a vector of unknown length is an
     * error. When unset, the pipeline default applies, except that vectors of
     * unknown length are always imputed across the whole column.
     */
    private static boolean resolveImputeBySlot(ColumnRequest request, PipelineDefaults defaults,
                                               ColumnTypeDescriptor sourceType) {
        if (request.imputeBySlot() != null) {
            if (request.imputeBySlot() && sourceType.isVariableLengthVector()) {
                throw new ConfigurationException(Reason.INVALID_SLOT_IMPUTATION, request.sourceName(),
                    String.format("Column '%s' of type '%s' has unknown length and cannot be imputed by slot",
                        request.sourceName(), TypeMapper.toRawKind(sourceType.toDataType())));
            }
            return request.imputeBySlot();
        }
        return defaults.imputeBySlot() && !sourceType.isVariableLengthVector();
    }
}
