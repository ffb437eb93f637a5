package com.napipe.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.napipe.exception.ConfigurationException;
import com.napipe.exception.ConfigurationException.Reason;
import com.napipe.plan.ColumnRequest;
import com.napipe.stage.StrategyKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses column requests from their compact text form and from JSON.
 *
 * <p>Text form: {@code name[:source][,kind=<strategy>][,slot=<bool>][,ind=<bool>]}.
 * The source defaults to the name. Examples:
 * <ul>
 *   <li>{@code age} - handle {@code age} in place with all settings unset</li>
 *   <li>{@code age_filled:age,kind=mean,ind=false}</li>
 *   <li>{@code features,slot=false}</li>
 * </ul>
 *
 * <p>JSON form: an array of objects with {@code name} and the optional fields
 * {@code source}, {@code kind}, {@code slot}, {@code ind}.
 *
 * @see StrategyAliases
 */
public class ColumnRequestParser {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Parses one request in text form.
     *
     * @param text the column definition
     * @return the request
     * @throws ConfigurationException if the definition is malformed
     */
    public static ColumnRequest parse(String text) {
        if (text == null || text.isBlank()) {
            throw invalid(text, "Column definition must not be empty");
        }

        String[] parts = text.split(",", -1);
        String head = parts[0].trim();
        int colon = head.indexOf(':');
        String name = colon == -1 ? head : head.substring(0, colon).trim();
        String source = colon == -1 ? name : head.substring(colon + 1).trim();
        if (name.isEmpty() || source.isEmpty()) {
            throw invalid(text, "Column definition '" + text + "' needs a name and a source");
        }

        StrategyKind strategy = null;
        Boolean slot = null;
        Boolean indicator = null;
        for (int i = 1; i < parts.length; i++) {
            String option = parts[i].trim();
            int eq = option.indexOf('=');
            if (eq <= 0) {
                throw invalid(text, "Malformed option '" + option + "' in column definition '" + text + "'");
            }
            String key = option.substring(0, eq).trim().toLowerCase(Locale.ROOT);
            String value = option.substring(eq + 1).trim();
            switch (key) {
                case "kind" -> strategy = parseStrategy(name, value);
                case "slot" -> slot = parseFlag(name, key, value);
                case "ind" -> indicator = parseFlag(name, key, value);
                default -> throw invalid(text, "Unknown option '" + key + "' in column definition '" + text + "'");
            }
        }

        return new ColumnRequest(name, source, strategy, slot, indicator);
    }

    /**
     * Parses several requests in text form.
     *
     * @param definitions the column definitions
     * @return the requests, in order
     */
    public static List<ColumnRequest> parseAll(List<String> definitions) {
        List<ColumnRequest> requests = new ArrayList<>(definitions.size());
        for (String definition : definitions) {
            requests.add(parse(definition));
        }
        return requests;
    }

    /**
     * Returns whether a request can be written in text form. The output name must
     * not contain {@code :} or {@code ,}, the source must not contain {@code ,},
     * and neither may carry surrounding whitespace.
     *
     * @param request the request
     * @return true if {@link #unparse} accepts the request
     */
    public static boolean canUnparse(ColumnRequest request) {
        String name = request.outputName();
        String source = request.sourceName();
        if (name.indexOf(':') != -1 || name.indexOf(',') != -1 || source.indexOf(',') != -1) {
            return false;
        }
        return name.equals(name.trim()) && source.equals(source.trim());
    }

    /**
     * Writes a request in text form. Unset settings are omitted, and the source is
     * omitted when it equals the name.
     *
     * @param request the request
     * @return the text form, accepted by {@link #parse}
     * @throws ConfigurationException if the column names cannot be written in text form
     * @see #canUnparse
     */
    public static String unparse(ColumnRequest request) {
        if (!canUnparse(request)) {
            throw invalid(request.outputName(), "Column '" + request.outputName() + "' with source '"
                + request.sourceName() + "' cannot be written in text form");
        }
        StringBuilder sb = new StringBuilder(request.outputName());
        if (!request.sourceName().equals(request.outputName())) {
            sb.append(':').append(request.sourceName());
        }
        if (request.strategy() != null) {
            sb.append(",kind=").append(StrategyAliases.canonicalName(request.strategy()));
        }
        if (request.imputeBySlot() != null) {
            sb.append(",slot=").append(request.imputeBySlot());
        }
        if (request.emitIndicator() != null) {
            sb.append(",ind=").append(request.emitIndicator());
        }
        return sb.toString();
    }

    /**
     * Parses requests from a JSON array.
     *
     * <pre>
     * [
     *   {"name": "age", "kind": "mean"},
     *   {"name": "features_filled", "source": "features", "slot": false, "ind": true}
     * ]
     * </pre>
     *
     * @param json the JSON text
     * @return the requests, in order
     * @throws ConfigurationException if the JSON is malformed or a request is invalid
     */
    public static List<ColumnRequest> parseJson(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException(Reason.INVALID_REQUEST, null,
                "Failed to parse column requests: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw invalid(null, "Column requests must be a JSON array");
        }

        List<ColumnRequest> requests = new ArrayList<>();
        for (JsonNode node : root) {
            if (!node.isObject()) {
                throw invalid(null, "Column request must be a JSON object: " + node);
            }
            String name = jsonText(node, "name", null);
            if (name == null) {
                throw invalid(null, "Column request without a name: " + node);
            }
            String source = jsonText(node, "source", name);
            if (source == null) {
                source = name;
            }
            String kind = jsonText(node, "kind", name);
            StrategyKind strategy = kind != null ? parseStrategy(name, kind) : null;
            Boolean slot = jsonFlag(node, "slot", name);
            Boolean indicator = jsonFlag(node, "ind", name);
            requests.add(new ColumnRequest(name, source, strategy, slot, indicator));
        }
        return requests;
    }

    /**
     * Returns a non-empty text option, or null when absent.
     */
    private static String jsonText(JsonNode node, String key, String column) {
        if (!node.hasNonNull(key)) {
            return null;
        }
        JsonNode value = node.get(key);
        if (!value.isTextual() || value.asText().isEmpty()) {
            throw invalid(column, "Option '" + key + "' of column request " + node + " must be a non-empty string");
        }
        return value.asText();
    }

    private static Boolean jsonFlag(JsonNode node, String key, String column) {
        if (!node.hasNonNull(key)) {
            return null;
        }
        JsonNode value = node.get(key);
        if (!value.isBoolean()) {
            throw invalid(column, "Option '" + key + "' of column '" + column + "' must be a boolean");
        }
        return value.asBoolean();
    }

    private static StrategyKind parseStrategy(String column, String value) {
        StrategyKind strategy = StrategyAliases.tryParse(value);
        if (strategy == null) {
            throw invalid(column, "Unknown replacement kind '" + value + "'");
        }
        return strategy;
    }

    private static Boolean parseFlag(String column, String key, String value) {
        String normalized = value.toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "true", "+" -> Boolean.TRUE;
            case "false", "-" -> Boolean.FALSE;
            default -> throw invalid(column, "Option '" + key + "' expects true or false but got '" + value + "'");
        };
    }

    private static ConfigurationException invalid(String column, String message) {
        return new ConfigurationException(Reason.INVALID_REQUEST, column, message);
    }
}
