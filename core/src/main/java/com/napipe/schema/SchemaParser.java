package com.napipe.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.napipe.types.BooleanType;
import com.napipe.types.ByteType;
import com.napipe.types.DataType;
import com.napipe.types.DoubleType;
import com.napipe.types.FloatType;
import com.napipe.types.IntegerType;
import com.napipe.types.LongType;
import com.napipe.types.ShortType;
import com.napipe.types.StringType;
import com.napipe.types.TimeSpanType;
import com.napipe.types.TimestampType;
import com.napipe.types.TypeMapper;
import com.napipe.types.VectorType;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses schema strings into Schema objects.
 *
 * <p>Supports two formats:
 * <ul>
 *   <li>DDL format: {@code struct<name:type,name2:type2>}</li>
 *   <li>JSON format: {@code {"fields":[{"name":"age","type":"double"},...]}}</li>
 * </ul>
 *
 * <p>Examples (DDL format):
 * <ul>
 *   <li>{@code struct<age:double,name:string>}</li>
 *   <li>{@code struct<features:vector<float,3>>}</li>
 *   <li>{@code struct<tokens:vector<float>>} (unknown length)</li>
 *   <li>{@code struct<age:R8,features:Vec<R4, 3>>} (raw-kind names)</li>
 * </ul>
 */
public class SchemaParser {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Parses a schema string into a Schema.
     *
     * @param schemaStr the schema string in DDL or JSON format
     * @return the parsed Schema
     * @throws SchemaException if the schema string is invalid
     */
    public static Schema parse(String schemaStr) {
        if (schemaStr == null || schemaStr.isEmpty()) {
            throw new SchemaException("Schema string cannot be null or empty");
        }

        String trimmed = schemaStr.trim();

        if (trimmed.startsWith("{")) {
            return parseJsonSchema(trimmed);
        }

        if (trimmed.toLowerCase().startsWith("struct<") && trimmed.endsWith(">")) {
            String inner = trimmed.substring(7, trimmed.length() - 1);
            return parseFields(inner);
        }

        // Plain field list
        return parseFields(trimmed);
    }

    /**
     * Parses a single type string such as {@code double} or {@code vector<float,3>}.
     *
     * @param typeStr the type string
     * @return the DataType
     * @throws SchemaException if the type is not recognized
     */
    public static DataType parseType(String typeStr) {
        String trimmed = typeStr.trim();
        String normalized = trimmed.toLowerCase();

        if (normalized.startsWith("vector<") && normalized.endsWith(">")) {
            String inner = trimmed.substring(7, trimmed.length() - 1);
            int commaIndex = findTopLevelComma(inner);
            if (commaIndex == -1) {
                return new VectorType(parseScalarType(inner));
            }
            DataType elementType = parseScalarType(inner.substring(0, commaIndex));
            String sizeStr = inner.substring(commaIndex + 1).trim();
            try {
                return new VectorType(elementType, Integer.parseInt(sizeStr));
            } catch (IllegalArgumentException e) {
                throw new SchemaException("Invalid vector type: " + typeStr, e);
            }
        }

        DataType rawKind;
        try {
            rawKind = TypeMapper.fromRawKind(trimmed);
        } catch (IllegalArgumentException e) {
            throw new SchemaException("Invalid type: " + typeStr, e);
        }
        if (rawKind != null) {
            return rawKind;
        }

        return parsePrimitiveType(normalized);
    }

    private static DataType parseScalarType(String typeStr) {
        DataType type = parseType(typeStr);
        if (type.isVector()) {
            throw new SchemaException("Vector element type must be scalar: " + typeStr);
        }
        return type;
    }

    /**
     * Parses a JSON schema string into a Schema.
     *
     * <p>Expected format:
     * <pre>
     * {
     *   "fields": [
     *     {"name": "age", "type": "double"},
     *     {"name": "features", "type": {"type": "vector", "elementType": "float", "size": 2},
     *      "slotNames": ["height", "weight"]}
     *   ]
     * }
     * </pre>
     *
     * @param jsonStr the JSON schema string
     * @return the parsed Schema
     */
    private static Schema parseJsonSchema(String jsonStr) {
        JsonNode root;
        try {
            root = objectMapper.readTree(jsonStr);
        } catch (JsonProcessingException e) {
            throw new SchemaException("Failed to parse JSON schema: " + e.getOriginalMessage(), e);
        }

        JsonNode fieldsNode = root.get("fields");
        if (fieldsNode == null || !fieldsNode.isArray()) {
            return Schema.EMPTY;
        }

        List<Field> fields = new ArrayList<>();
        for (JsonNode fieldNode : fieldsNode) {
            JsonNode nameNode = fieldNode.get("name");
            if (nameNode == null || !nameNode.isTextual()) {
                throw new SchemaException("JSON field without a name: " + fieldNode);
            }
            DataType dataType = parseJsonDataType(fieldNode.get("type"));

            List<String> slotNames = new ArrayList<>();
            JsonNode slotsNode = fieldNode.get("slotNames");
            if (slotsNode != null && slotsNode.isArray()) {
                for (JsonNode slot : slotsNode) {
                    slotNames.add(slot.asText());
                }
            }
            try {
                fields.add(new Field(nameNode.asText(), dataType, slotNames));
            } catch (IllegalArgumentException e) {
                throw new SchemaException(e.getMessage(), e);
            }
        }

        return new Schema(fields);
    }

    /**
     * Parses a JSON node representing a data type.
     * Handles simple types (string like "double") and vectors (object like {"type":"vector",...}).
     */
    private static DataType parseJsonDataType(JsonNode typeNode) {
        if (typeNode == null) {
            throw new SchemaException("Type node cannot be null");
        }

        if (typeNode.isTextual()) {
            return parseType(typeNode.asText());
        }

        if (typeNode.isObject() && typeNode.has("type")) {
            String typeName = typeNode.get("type").asText().toLowerCase();
            if (typeName.equals("vector")) {
                DataType elementType = parseJsonDataType(typeNode.get("elementType"));
                int size = typeNode.has("size") ? typeNode.get("size").asInt() : 0;
                try {
                    return new VectorType(elementType, size);
                } catch (IllegalArgumentException e) {
                    throw new SchemaException("Invalid vector type: " + typeNode, e);
                }
            }
            return parsePrimitiveType(typeName);
        }

        throw new SchemaException("Unsupported type node: " + typeNode);
    }

    /**
     * Parses the field definitions of a DDL schema.
     *
     * @param fieldsStr the comma-separated field definitions
     * @return the parsed Schema
     */
    private static Schema parseFields(String fieldsStr) {
        if (fieldsStr.isEmpty()) {
            return Schema.EMPTY;
        }

        List<Field> fields = new ArrayList<>();
        for (String fieldDef : splitTopLevel(fieldsStr, ',')) {
            fields.add(parseField(fieldDef.trim()));
        }

        return new Schema(fields);
    }

    /**
     * Parses a single field definition.
     *
     * @param fieldDef the field definition (e.g., "age:double")
     * @return the parsed Field
     */
    private static Field parseField(String fieldDef) {
        int colonIndex = fieldDef.indexOf(':');
        if (colonIndex <= 0) {
            throw new SchemaException("Invalid field definition: " + fieldDef);
        }

        String name = fieldDef.substring(0, colonIndex).trim();
        String typeStr = fieldDef.substring(colonIndex + 1).trim();
        return new Field(name, parseType(typeStr));
    }

    /**
     * Parses a primitive type string.
     *
     * @param typeStr the normalized type string (lowercase)
     * @return the DataType
     */
    private static DataType parsePrimitiveType(String typeStr) {
        switch (typeStr) {
            // Integer types
            case "byte":
            case "tinyint":
                return ByteType.get();
            case "short":
            case "smallint":
                return ShortType.get();
            case "int":
            case "integer":
                return IntegerType.get();
            case "long":
            case "bigint":
                return LongType.get();

            // Floating point types
            case "float":
            case "real":
                return FloatType.get();
            case "double":
                return DoubleType.get();

            // String and boolean
            case "string":
            case "text":
                return StringType.get();
            case "boolean":
            case "bool":
                return BooleanType.get();

            // Temporal types
            case "timespan":
            case "duration":
                return TimeSpanType.get();
            case "timestamp":
            case "datetime":
                return TimestampType.get();

            default:
                throw new SchemaException("Unsupported type: " + typeStr);
        }
    }

    /**
     * Splits a string by a delimiter, respecting nested angle brackets.
     *
     * @param str the string to split
     * @param delimiter the delimiter character
     * @return the list of parts
     */
    private static List<String> splitTopLevel(String str, char delimiter) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;

        for (int i = 0; i < str.length(); i++) {
            char c = str.charAt(i);
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth--;
            } else if (c == delimiter && depth == 0) {
                String part = str.substring(start, i).trim();
                if (!part.isEmpty()) {
                    parts.add(part);
                }
                start = i + 1;
            }
        }

        if (start < str.length()) {
            String part = str.substring(start).trim();
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }

        return parts;
    }

    /**
     * Finds the top-level comma in a string (ignoring nested angle brackets).
     *
     * @param str the string to search
     * @return the index of the comma, or -1 if not found
     */
    private static int findTopLevelComma(String str) {
        int depth = 0;
        for (int i = 0; i < str.length(); i++) {
            char c = str.charAt(i);
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth--;
            } else if (c == ',' && depth == 0) {
                return i;
            }
        }
        return -1;
    }
}
