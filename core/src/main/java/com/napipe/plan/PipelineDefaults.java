package com.napipe.plan;

import com.napipe.parser.StrategyAliases;
import com.napipe.stage.StrategyKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Pipeline-wide settings used wherever a {@link ColumnRequest} leaves one unset.
 *
 * <p>{@code imputeBySlot} only applies to columns that can be imputed by slot;
 * vectors of unknown length fall back to whole-column imputation.
 *
 * @param strategy the default replacement strategy
 * @param imputeBySlot the default slot-imputation setting
 * @param emitIndicator the default indicator setting
 */
public record PipelineDefaults(StrategyKind strategy, boolean imputeBySlot, boolean emitIndicator) {

    private static final Logger logger = LoggerFactory.getLogger(PipelineDefaults.class);

    /** System property for the default strategy */
    static final String PROP_STRATEGY = "napipe.defaultStrategy";

    /** System property for the default slot-imputation setting */
    static final String PROP_IMPUTE_BY_SLOT = "napipe.imputeBySlot";

    /** System property for the default indicator setting */
    static final String PROP_EMIT_INDICATOR = "napipe.emitIndicator";

    public PipelineDefaults {
        Objects.requireNonNull(strategy, "strategy must not be null");
    }

    /**
     * Returns the standard defaults: default-value replacement, slot imputation and
     * indicator emission enabled.
     *
     * @return the standard defaults
     */
    public static PipelineDefaults standard() {
        return new PipelineDefaults(StrategyKind.DEFAULT, true, true);
    }

    /**
     * Returns the standard defaults overridden by the {@code napipe.*} system properties.
     *
     * <p>Values that cannot be parsed are logged and ignored.
     *
     * @return the configured defaults
     */
    public static PipelineDefaults fromSystemProperties() {
        PipelineDefaults standard = standard();
        return new PipelineDefaults(
            configuredStrategy(standard.strategy()),
            configuredFlag(PROP_IMPUTE_BY_SLOT, standard.imputeBySlot()),
            configuredFlag(PROP_EMIT_INDICATOR, standard.emitIndicator()));
    }

    public PipelineDefaults withStrategy(StrategyKind newStrategy) {
        return new PipelineDefaults(newStrategy, imputeBySlot, emitIndicator);
    }

    public PipelineDefaults withImputeBySlot(boolean newImputeBySlot) {
        return new PipelineDefaults(strategy, newImputeBySlot, emitIndicator);
    }

    public PipelineDefaults withEmitIndicator(boolean newEmitIndicator) {
        return new PipelineDefaults(strategy, imputeBySlot, newEmitIndicator);
    }

    // ========== Configuration Helpers ==========

    private static StrategyKind configuredStrategy(StrategyKind fallback) {
        String value = System.getProperty(PROP_STRATEGY);
        if (value != null) {
            StrategyKind parsed = StrategyAliases.tryParse(value);
            if (parsed != null) {
                return parsed;
            }
            logger.warn("Ignoring unknown value '{}' for {}", value, PROP_STRATEGY);
        }
        return fallback;
    }

    static boolean configuredFlag(String property, boolean fallback) {
        String value = System.getProperty(property);
        if (value != null) {
            String normalized = value.trim().toLowerCase();
            if (normalized.equals("true") || normalized.equals("false")) {
                return Boolean.parseBoolean(normalized);
            }
            logger.warn("Ignoring non-boolean value '{}' for {}", value, property);
        }
        return fallback;
    }
}
