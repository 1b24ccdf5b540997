package co.fanki.surveyflow.flow.domain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSON form of persisted determinants.
 *
 * <p>A determinant is stored as {@code {"type":"GO_TO_QUESTION",
 * "questionId":"..."}}, {@code {"type":"END_SURVEY"}} or
 * {@code {"type":"SEQUENTIAL"}}. Option overrides are stored as an object
 * keyed by option index.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class NavigationDeterminantJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private NavigationDeterminantJson() {
    }

    /**
     * Serializes a determinant.
     *
     * @param determinant the determinant, addressed by persisted id
     * @return the JSON text
     */
    public static String toJson(
            final NavigationDeterminant<String> determinant) {
        return write(toNode(determinant));
    }

    /**
     * Parses a determinant.
     *
     * @param json the JSON text, null is read as sequential
     * @return the determinant
     */
    public static NavigationDeterminant<String> fromJson(final String json) {
        if (json == null || json.isBlank()) {
            return NavigationDeterminant.sequential();
        }
        return fromNode(read(json));
    }

    /**
     * Serializes per-option overrides.
     *
     * @param overrides option index to determinant
     * @return the JSON text
     */
    public static String overridesToJson(
            final Map<Integer, NavigationDeterminant<String>> overrides) {
        final ObjectNode root = MAPPER.createObjectNode();
        for (final Map.Entry<Integer, NavigationDeterminant<String>> entry
                : overrides.entrySet()) {
            root.set(String.valueOf(entry.getKey()),
                    toNode(entry.getValue()));
        }
        return write(root);
    }

    /**
     * Parses per-option overrides.
     *
     * @param json the JSON text, null is read as no overrides
     * @return option index to determinant, ordered by option index
     */
    public static Map<Integer, NavigationDeterminant<String>>
            overridesFromJson(final String json) {
        final Map<Integer, NavigationDeterminant<String>> result =
                new TreeMap<>();
        if (json == null || json.isBlank()) {
            return result;
        }
        final JsonNode root = read(json);
        final Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            result.put(Integer.parseInt(field.getKey()),
                    fromNode(field.getValue()));
        }
        return result;
    }

    private static ObjectNode toNode(
            final NavigationDeterminant<String> determinant) {
        final ObjectNode node = MAPPER.createObjectNode();
        node.put("type", determinant.type().name());
        if (determinant.isGoTo()) {
            node.put("questionId", determinant.target());
        }
        return node;
    }

    private static NavigationDeterminant<String> fromNode(final JsonNode node) {
        final NavigationDeterminant.Type type = NavigationDeterminant.Type
                .valueOf(node.path("type").asText());
        return switch (type) {
            case GO_TO_QUESTION -> NavigationDeterminant.goTo(
                    node.path("questionId").asText());
            case END_SURVEY -> NavigationDeterminant.endSurvey();
            case SEQUENTIAL -> NavigationDeterminant.sequential();
        };
    }

    private static String write(final JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException(
                    "Failed to serialize determinant", e);
        }
    }

    private static JsonNode read(final String json) {
        try {
            return MAPPER.readTree(json);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException(
                    "Failed to parse determinant: " + json, e);
        }
    }

}
