package com.napipe.types;

/**
 * Maps napipe DataTypes to and from their short raw-kind names.
 *
 * <p>Raw-kind names are the compact notation used in diagnostics and accepted by
 * the schema parser:
 * <pre>
 *   BooleanType          → "BL"
 *   ByteType             → "I1"
 *   ShortType            → "I2"
 *   IntegerType          → "I4"
 *   LongType             → "I8"
 *   FloatType            → "R4"
 *   DoubleType           → "R8"
 *   StringType           → "TX"
 *   TimeSpanType         → "TS"
 *   TimestampType        → "DT"
 *   VectorType(R4, 3)    → "Vec&lt;R4, 3&gt;"
 *   VectorType(R4)       → "Vec&lt;R4&gt;"
 * </pre>
 *
 * @see DataType
 */
public class TypeMapper {

    /**
     * Converts a DataType to its raw-kind name.
     *
     * @param type the data type
     * @return the raw-kind name
     */
    public static String toRawKind(DataType type) {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (type instanceof VectorType vector) {
            String element = toRawKind(vector.elementType());
            return vector.isKnownSize()
                ? "Vec<" + element + ", " + vector.size() + ">"
                : "Vec<" + element + ">";
        }
        if (type instanceof BooleanType) return "BL";
        if (type instanceof ByteType) return "I1";
        if (type instanceof ShortType) return "I2";
        if (type instanceof IntegerType) return "I4";
        if (type instanceof LongType) return "I8";
        if (type instanceof FloatType) return "R4";
        if (type instanceof DoubleType) return "R8";
        if (type instanceof StringType) return "TX";
        if (type instanceof TimeSpanType) return "TS";
        if (type instanceof TimestampType) return "DT";
        throw new UnsupportedOperationException("Unsupported type: " + type);
    }

    /**
     * Converts a raw-kind name back to a DataType.
     *
     * <p>This is the reverse operation of {@link #toRawKind(DataType)}.
     *
     * @param rawKind the raw-kind name
     * @return the data type, or null if the name is not a raw-kind name
     */
    public static DataType fromRawKind(String rawKind) {
        if (rawKind == null || rawKind.isEmpty()) {
            throw new IllegalArgumentException("rawKind must not be null or empty");
        }

        String normalized = rawKind.trim().toUpperCase();

        if (normalized.startsWith("VEC<") && normalized.endsWith(">")) {
            String inner = normalized.substring(4, normalized.length() - 1);
            int comma = inner.indexOf(',');
            String elementName = comma == -1 ? inner : inner.substring(0, comma);
            DataType element = fromRawKind(elementName.trim());
            if (element == null) {
                return null;
            }
            if (comma == -1) {
                return new VectorType(element);
            }
            try {
                return new VectorType(element, Integer.parseInt(inner.substring(comma + 1).trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid vector size in: " + rawKind, e);
            }
        }

        return switch (normalized) {
            case "BL" -> BooleanType.get();
            case "I1" -> ByteType.get();
            case "I2" -> ShortType.get();
            case "I4" -> IntegerType.get();
            case "I8" -> LongType.get();
            case "R4" -> FloatType.get();
            case "R8" -> DoubleType.get();
            case "TX" -> StringType.get();
            case "TS" -> TimeSpanType.get();
            case "DT" -> TimestampType.get();
            default -> null;
        };
    }
}
