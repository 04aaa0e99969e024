package work.lcod.strata.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import work.lcod.strata.tree.Node;
import work.lcod.strata.tree.NodeFlag;
import work.lcod.strata.tree.NumericKeyComparator;
import work.lcod.strata.value.Value;

/**
 * JSON view of a tree.
 *
 * <p>Encoding: a leaf without flags becomes its value. Other nodes become an array when flagged
 * {@link NodeFlag#FORCE_ARRAY} or, unless flagged {@link NodeFlag#FORCE_MAP}, when every child
 * key is an integer; otherwise an object. Both follow the child order.
 *
 * <p>Decoding: objects add children in document order, arrays add children keyed {@code 1..n}
 * and scalars become values. Empty containers leave an empty node flagged with their kind.
 */
public final class TreeJson {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private TreeJson() {}

    public static String encode(Node node) {
        return encode(node, false);
    }

    public static String encode(Node node, boolean pretty) {
        try {
            JsonNode json = toJson(node);
            return pretty ? JSON.writerWithDefaultPrettyPrinter().writeValueAsString(json) : JSON.writeValueAsString(json);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to encode tree as JSON", ex);
        }
    }

    public static JsonNode toJson(Node node) {
        if (node == null) {
            return NODES.nullNode();
        }
        boolean forceArray = node.hasFlag(NodeFlag.FORCE_ARRAY);
        boolean forceMap = node.hasFlag(NodeFlag.FORCE_MAP);
        if (node.isLeaf() && !forceArray && !forceMap) {
            return toJson(node.value());
        }
        if (forceArray || (!forceMap && NumericKeyComparator.allNumeric(node.childKeys()))) {
            ArrayNode array = NODES.arrayNode();
            for (Node child : node.children()) {
                array.add(toJson(child));
            }
            return array;
        }
        ObjectNode object = NODES.objectNode();
        for (Node child : node.children()) {
            object.set(child.key(), toJson(child));
        }
        return object;
    }

    static JsonNode toJson(Value value) {
        if (value == null) {
            return NODES.nullNode();
        }
        if (value instanceof Value.IntegerValue integer) {
            return NODES.numberNode(integer.value());
        }
        if (value instanceof Value.FloatValue number) {
            return NODES.numberNode(number.value());
        }
        if (value instanceof Value.BooleanValue bool) {
            return NODES.booleanNode(bool.value());
        }
        if (value instanceof Value.ListValue list) {
            ArrayNode array = NODES.arrayNode();
            for (Value item : list.items()) {
                array.add(toJson(item));
            }
            return array;
        }
        return NODES.textNode(value.asText());
    }

    /**
     * Parses a JSON document into a new scope root.
     */
    public static Node decode(String json) throws IOException {
        return merge(Node.newRoot(), JSON.readTree(json));
    }

    public static Node mergeJson(Node target, Reader reader) throws IOException {
        return merge(target, JSON.readTree(reader));
    }

    /**
     * Writes a parsed JSON (or YAML) document under {@code target}.
     */
    public static Node merge(Node target, JsonNode document) {
        if (document != null && !document.isMissingNode()) {
            mergeInto(target, new ArrayList<>(), document);
        }
        return target;
    }

    private static void mergeInto(Node target, List<String> path, JsonNode json) {
        if (json.isObject()) {
            if (json.isEmpty()) {
                flagContainer(target, path, NodeFlag.FORCE_MAP);
                return;
            }
            Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                path.add(field.getKey());
                mergeInto(target, path, field.getValue());
                path.remove(path.size() - 1);
            }
        } else if (json.isArray()) {
            if (json.isEmpty()) {
                flagContainer(target, path, NodeFlag.FORCE_ARRAY);
                return;
            }
            int index = 0;
            for (JsonNode item : json) {
                path.add(Integer.toString(++index));
                mergeInto(target, path, item);
                path.remove(path.size() - 1);
            }
        } else if (!path.isEmpty()) {
            target.set(path, scalar(json));
        }
    }

    private static void flagContainer(Node target, List<String> path, NodeFlag flag) {
        Node container = path.isEmpty() ? target : target.addNode(path);
        container.addFlag(flag);
    }

    private static Object scalar(JsonNode json) {
        if (json.isNull()) {
            return null;
        }
        if (json.isIntegralNumber()) {
            return json.canConvertToLong() ? (Object) json.longValue() : json.bigIntegerValue();
        }
        if (json.isNumber()) {
            return json.doubleValue();
        }
        if (json.isBoolean()) {
            return json.booleanValue();
        }
        return json.asText();
    }
}
