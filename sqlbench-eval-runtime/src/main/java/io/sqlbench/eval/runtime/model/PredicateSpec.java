package io.sqlbench.eval.runtime.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A verification predicate described as data: a type name plus its options. The JSON string
 * {@code "plan_cost"} is shorthand for {@code {"type": "plan_cost"}}.
 */
public record PredicateSpec(String type, Map<String, Object> options) {

    public static final String TYPE_KEY = "type";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public PredicateSpec {
        options = options == null ? Map.of() : options;
    }

    public static PredicateSpec of(String type) {
        return new PredicateSpec(type, Map.of());
    }

    public static PredicateSpec fromJson(JsonNode node) {
        if (node == null || node.isNull()) {
            return new PredicateSpec(null, Map.of());
        }
        if (node.isTextual()) {
            return of(node.asText());
        }
        if (node.isObject()) {
            Map<String, Object> options = MAPPER.convertValue(node, MAPPER.getTypeFactory()
                    .constructMapType(LinkedHashMap.class, String.class, Object.class));
            var type = options.remove(TYPE_KEY);
            return new PredicateSpec(type == null ? null : type.toString(), options);
        }
        // Source text and other shapes are not executable
        return new PredicateSpec(null, Map.of("source", node.toString()));
    }

    /**
     * Parse a nested spec found inside another spec's options.
     */
    public static PredicateSpec fromObject(Object value) {
        return fromJson(MAPPER.valueToTree(value));
    }

    public Object option(String name) {
        return options.get(name);
    }

    public boolean hasOption(String name) {
        return options.containsKey(name);
    }

    @SuppressWarnings("unchecked")
    public List<Object> listOption(String name) {
        var value = options.get(name);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return (List<Object>) list;
        }
        return List.of(value);
    }
}
