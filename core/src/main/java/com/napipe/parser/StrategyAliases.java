package com.napipe.parser;

import com.napipe.stage.StrategyKind;

import java.util.Locale;

/**
 * Accepted spellings of the replacement strategies.
 *
 * <pre>
 *   default, def, defaultvalue, zero → DEFAULT
 *   mean                             → MEAN
 *   min, minimum                     → MINIMUM
 *   max, maximum                     → MAXIMUM
 * </pre>
 */
public final class StrategyAliases {

    private StrategyAliases() {}

    /**
     * Parses a strategy name, ignoring case.
     *
     * @param value the name
     * @return the strategy, or null if the name is not recognized
     */
    public static StrategyKind tryParse(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "default", "def", "defaultvalue", "zero" -> StrategyKind.DEFAULT;
            case "mean" -> StrategyKind.MEAN;
            case "min", "minimum" -> StrategyKind.MINIMUM;
            case "max", "maximum" -> StrategyKind.MAXIMUM;
            default -> null;
        };
    }

    /**
     * Returns the canonical name of a strategy, as written by {@link ColumnRequestParser#unparse}.
     *
     * @param strategy the strategy
     * @return the canonical name
     */
    public static String canonicalName(StrategyKind strategy) {
        return switch (strategy) {
            case DEFAULT -> "default";
            case MEAN -> "mean";
            case MINIMUM -> "min";
            case MAXIMUM -> "max";
        };
    }
}
