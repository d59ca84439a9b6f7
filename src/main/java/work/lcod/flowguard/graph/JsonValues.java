package work.lcod.flowguard.graph;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the plain Java representation of JSON values (ordered maps, lists, scalars)
 * used for step parameters and preserved document fields.
 */
public final class JsonValues {
    private JsonValues() {}

    public static Object fromNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isObject()) {
            return objectFromNode(node);
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(fromNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node.asText();
    }

    public static Map<String, Object> objectFromNode(JsonNode node) {
        var map = new LinkedHashMap<String, Object>();
        var fields = node.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            map.put(entry.getKey(), fromNode(entry.getValue()));
        }
        return map;
    }

    public static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            return copyMap(map);
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<Object>(list.size());
            for (var item : list) {
                copy.add(deepCopy(item));
            }
            return copy;
        }
        return value;
    }

    public static Map<String, Object> copyMap(Map<?, ?> map) {
        if (map == null) {
            return null;
        }
        var copy = new LinkedHashMap<String, Object>();
        for (var entry : map.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), deepCopy(entry.getValue()));
        }
        return copy;
    }
}
