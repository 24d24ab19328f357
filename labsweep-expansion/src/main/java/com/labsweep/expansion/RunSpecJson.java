package com.labsweep.expansion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * JSON form of an expanded sweep: an array of runs, each an array of single-key objects,
 * e.g. {@code [[{"P1":1},{"P2":3}],[{"P1":1},{"P2":4}]]}. Integers stay integers.
 */
public final class RunSpecJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private RunSpecJson() {
    }

    /**
     * @throws UncheckedIOException on serialization failure
     */
    public static String toJson(List<RunSpec> runs) {
        ArrayNode root = MAPPER.createArrayNode();
        for (RunSpec run : runs) {
            ArrayNode group = root.addArray();
            for (ParameterAssignment a : run.getAssignments()) {
                ObjectNode mapping = group.addObject();
                Object v = a.value();
                if (v instanceof Long l) {
                    mapping.put(a.parameter(), l);
                } else if (v instanceof Double d) {
                    mapping.put(a.parameter(), d);
                } else if (v instanceof Boolean b) {
                    mapping.put(a.parameter(), b);
                } else {
                    mapping.put(a.parameter(), String.valueOf(v));
                }
            }
        }
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /**
     * @throws UncheckedIOException     when the text is not JSON
     * @throws IllegalArgumentException when the JSON does not have the run spec shape
     */
    public static List<RunSpec> fromJson(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (root == null || !root.isArray()) {
            throw new IllegalArgumentException("Expected a JSON array of runs");
        }
        List<RunSpec> runs = new ArrayList<>(root.size());
        for (JsonNode group : root) {
            if (!group.isArray()) {
                throw new IllegalArgumentException("Expected each run to be an array of mappings, got: " + group);
            }
            List<ParameterAssignment> assignments = new ArrayList<>(group.size());
            for (JsonNode mapping : group) {
                if (!mapping.isObject() || mapping.size() != 1) {
                    throw new IllegalArgumentException("Expected a single-key object, got: " + mapping);
                }
                Iterator<Map.Entry<String, JsonNode>> fields = mapping.fields();
                Map.Entry<String, JsonNode> field = fields.next();
                assignments.add(new ParameterAssignment(field.getKey(), scalar(field.getValue())));
            }
            runs.add(new RunSpec(assignments));
        }
        return runs;
    }

    private static Object scalar(JsonNode node) {
        if (node.isIntegralNumber() && node.canConvertToLong()) return node.asLong();
        if (node.isNumber()) return node.asDouble();
        if (node.isBoolean()) return node.asBoolean();
        if (node.isTextual()) return node.asText();
        throw new IllegalArgumentException("Unsupported parameter value: " + node);
    }
}
