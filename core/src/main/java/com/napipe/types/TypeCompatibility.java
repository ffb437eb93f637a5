package com.napipe.types;

import java.util.Objects;

/**
 * Decides which standard conversions exist between item types.
 *
 * <p>The table is closed over the supported item types:
 * <pre>
 *   same type            → identity
 *   boolean  → numeric   → conversion (false = 0, true = 1)
 *   boolean  → text      → conversion
 *   numeric  → numeric   → conversion
 *   any      → text      → conversion
 *   text     → any       → conversion (parsing)
 * </pre>
 *
 * <p>No conversion exists from boolean to the temporal types, between the two
 * temporal types, or between temporal and numeric types.
 */
public final class TypeCompatibility {

    private TypeCompatibility() {}

    /**
     * Outcome of a conversion lookup.
     *
     * @param possible whether a standard conversion exists
     * @param isIdentity whether the conversion is a no-op requiring no coercion stage
     */
    public record Conversion(boolean possible, boolean isIdentity) {

        static final Conversion IDENTITY = new Conversion(true, true);
        static final Conversion CONVERT = new Conversion(true, false);
        static final Conversion NONE = new Conversion(false, false);

        public Conversion {
            if (isIdentity && !possible) {
                throw new IllegalArgumentException("an identity conversion is always possible");
            }
        }
    }

    /**
     * Looks up the standard conversion between two item types.
     *
     * <p>Vector types are compared by their item types.
     *
     * @param from the source type
     * @param to the target type
     * @return the conversion outcome, never null
     */
    public static Conversion canConvert(DataType from, DataType to) {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");

        DataType source = from.itemType();
        DataType target = to.itemType();
        if (source.equals(target)) {
            return Conversion.IDENTITY;
        }

        ItemKind sourceKind = source.itemKind();
        ItemKind targetKind = target.itemKind();
        if (targetKind == ItemKind.TEXT || sourceKind == ItemKind.TEXT) {
            return Conversion.CONVERT;
        }
        return switch (sourceKind) {
            case BOOLEAN, NUMERIC -> targetKind == ItemKind.NUMERIC ? Conversion.CONVERT : Conversion.NONE;
            case TIME_SPAN, DATE_TIME, TEXT -> Conversion.NONE;
        };
    }

    /**
     * Decides whether a boolean indicator can be represented in the given item type
     * so that it can be merged with a value column of that type.
     *
     * @param indicatorType the indicator type
     * @param targetItemType the item type of the value column
     * @return the conversion outcome for boolean → target
     */
    public static Conversion canRepresent(BooleanType indicatorType, DataType targetItemType) {
        return canConvert(indicatorType, targetItemType);
    }
}
