package io.mvfm.core.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.mvfm.core.dag.DirtyGraph;
import io.mvfm.core.error.GraphDocumentException;
import io.mvfm.core.error.GraphIntegrityException;
import io.mvfm.core.model.NodeEntry;
import io.mvfm.core.model.NodeIds;
import io.mvfm.core.model.NormalizedGraph;
import io.mvfm.core.model.Payload;
import io.mvfm.core.model.TypeTag;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes {@link NormalizedGraph}s as JSON or YAML documents.
 *
 * <p>Document shape:
 *
 * <pre>
 * root: e
 * nextId: f
 * outputType: number
 * nodes:
 *   a: { kind: num/literal, children: [], value: 3 }
 *   c: { kind: num/add, children: [a, b] }
 *   g: { kind: core/access, children: [f], key: name }
 *   h: { kind: core/record, children: [a, b], fields: { x: a, y: b } }
 *   i: { kind: core/tuple, children: [a, b], elements: [a, b] }
 *   "@total": { kind: "@alias", children: [e] }
 * </pre>
 *
 * <p>Node order in the document is the adjacency order, both ways. Numeric literals are read back
 * as {@link Double}. A decoded document must pass the same integrity check as
 * {@link DirtyGraph#commit()}, and its {@code nextId} must come after every node id.
 *
 * <p>Thread-safe: the mappers are shared and never reconfigured after construction.
 */
public final class GraphDocumentCodec {

    private static final Logger LOG = LoggerFactory.getLogger(GraphDocumentCodec.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper PRETTY_JSON_MAPPER =
            new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private GraphDocumentCodec() {}

    // ── Encoding ──

    /** Writes {@code graph} as compact JSON. */
    public static String encodeJson(NormalizedGraph graph) {
        return write(JSON_MAPPER, graph);
    }

    /** Writes {@code graph} as indented JSON. */
    public static String encodePrettyJson(NormalizedGraph graph) {
        return write(PRETTY_JSON_MAPPER, graph);
    }

    /** Writes {@code graph} as YAML. */
    public static String encodeYaml(NormalizedGraph graph) {
        return write(YAML_MAPPER, graph);
    }

    /** Builds the document tree for {@code graph}. */
    public static ObjectNode toTree(NormalizedGraph graph) {
        Objects.requireNonNull(graph, "graph must not be null");
        ObjectNode root = JSON_MAPPER.createObjectNode();
        root.put("root", graph.rootId());
        root.put("nextId", graph.nextId());
        root.put("outputType", graph.outputType().wireName());
        ObjectNode nodes = root.putObject("nodes");
        graph.adjacency().forEach((id, entry) -> nodes.set(id, encodeEntry(entry)));
        return root;
    }

    private static String write(ObjectMapper mapper, NormalizedGraph graph) {
        try {
            return mapper.writeValueAsString(toTree(graph));
        } catch (JsonProcessingException e) {
            throw new GraphDocumentException(
                    "Failed to write graph document: " + e.getOriginalMessage(), e, graph.rootId(), null);
        }
    }

    private static ObjectNode encodeEntry(NodeEntry entry) {
        ObjectNode node = JSON_MAPPER.createObjectNode();
        node.put("kind", entry.kind());
        ArrayNode children = node.putArray("children");
        entry.children().forEach(children::add);
        Payload payload = entry.payload();
        if (payload instanceof Payload.Literal literal) {
            node.set("value", JSON_MAPPER.valueToTree(literal.value()));
        } else if (payload instanceof Payload.AccessKey access) {
            if (access.key() instanceof Integer index) {
                node.put("key", index);
            } else {
                node.put("key", (String) access.key());
            }
        } else if (payload instanceof Payload.RecordLayout layout) {
            ObjectNode fields = node.putObject("fields");
            layout.fields().forEach(fields::put);
        } else if (payload instanceof Payload.TupleLayout layout) {
            ArrayNode elements = node.putArray("elements");
            layout.elements().forEach(elements::add);
        }
        return node;
    }

    // ── Decoding ──

    /**
     * Reads a JSON document.
     *
     * @throws GraphDocumentException if the text is not a well-formed graph document
     */
    public static NormalizedGraph decodeJson(String json) {
        Objects.requireNonNull(json, "json must not be null");
        return fromTree(read(JSON_MAPPER, json, "JSON"));
    }

    /**
     * Reads a YAML document.
     *
     * @throws GraphDocumentException if the text is not a well-formed graph document
     */
    public static NormalizedGraph decodeYaml(String yaml) {
        Objects.requireNonNull(yaml, "yaml must not be null");
        return fromTree(read(YAML_MAPPER, yaml, "YAML"));
    }

    /**
     * Builds a graph from a document tree.
     *
     * @throws GraphDocumentException if a field is missing or malformed, or the graph has a broken
     *     reference
     */
    public static NormalizedGraph fromTree(JsonNode document) {
        if (document == null || !document.isObject()) {
            throw new GraphDocumentException("Graph document must be an object", null, null);
        }
        String rootId = requireString(document, "root", null);
        String nextId = requireString(document, "nextId", null);
        TypeTag outputType = parseOutputType(document);

        JsonNode nodes = document.get("nodes");
        if (nodes == null || !nodes.isObject()) {
            throw new GraphDocumentException("Missing or invalid required field: 'nodes'", null, null);
        }
        Map<String, NodeEntry> adjacency = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = nodes.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            adjacency.put(field.getKey(), decodeEntry(field.getKey(), field.getValue()));
        }

        try {
            DirtyGraph.validate(rootId, adjacency, "decode");
        } catch (GraphIntegrityException e) {
            throw new GraphDocumentException(e.getMessage(), e, e.nodeId(), e.kind());
        }
        requireFreshCursor(nextId, adjacency);
        LOG.debug("Decoded graph document: root={}, nodes={}", rootId, adjacency.size());
        return new NormalizedGraph(rootId, adjacency, nextId, outputType);
    }

    /** The cursor must sort after every node id, or the next allocation would overwrite a node. */
    private static void requireFreshCursor(String nextId, Map<String, NodeEntry> adjacency) {
        adjacency.forEach((id, entry) -> {
            if (!entry.isAlias() && NodeIds.compare(id, nextId) >= 0) {
                throw new GraphDocumentException(
                        "nextId '" + nextId + "' is not past existing node '" + id + "'", id, entry.kind());
            }
        });
    }

    private static JsonNode read(ObjectMapper mapper, String text, String format) {
        try {
            return mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new GraphDocumentException(
                    "Failed to parse " + format + " graph document: " + e.getOriginalMessage(), e, null, null);
        }
    }

    private static TypeTag parseOutputType(JsonNode document) {
        JsonNode node = document.get("outputType");
        if (node == null || node.isNull()) {
            return TypeTag.ANY;
        }
        try {
            return TypeTag.fromWireName(node.asText());
        } catch (IllegalArgumentException e) {
            throw new GraphDocumentException(e.getMessage(), e, null, null);
        }
    }

    private static NodeEntry decodeEntry(String id, JsonNode node) {
        if (!node.isObject()) {
            throw new GraphDocumentException("Node '" + id + "' must be an object", id, null);
        }
        String kind = requireString(node, "kind", id);
        List<String> children = stringList(node.get("children"), "children", id, kind);
        Payload payload = decodePayload(id, kind, node);
        try {
            return new NodeEntry(kind, children, payload);
        } catch (IllegalArgumentException e) {
            throw new GraphDocumentException("Node '" + id + "': " + e.getMessage(), e, id, kind);
        }
    }

    private static Payload decodePayload(String id, String kind, JsonNode node) {
        if (node.has("value")) {
            return new Payload.Literal(toValue(node.get("value")));
        }
        if (node.has("key")) {
            JsonNode key = node.get("key");
            if (key.isInt()) {
                return new Payload.AccessKey(key.intValue());
            }
            if (key.isTextual()) {
                return new Payload.AccessKey(key.textValue());
            }
            throw new GraphDocumentException(
                    "Node '" + id + "': access key must be a string or integer", id, kind);
        }
        if (node.has("fields")) {
            JsonNode fields = node.get("fields");
            if (!fields.isObject()) {
                throw new GraphDocumentException("Node '" + id + "': 'fields' must be an object", id, kind);
            }
            Map<String, String> layout = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = fields.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> field = it.next();
                if (!field.getValue().isTextual()) {
                    throw new GraphDocumentException(
                            "Node '" + id + "': field '" + field.getKey() + "' must name a node id", id, kind);
                }
                layout.put(field.getKey(), field.getValue().textValue());
            }
            return new Payload.RecordLayout(layout);
        }
        if (node.has("elements")) {
            return new Payload.TupleLayout(stringList(node.get("elements"), "elements", id, kind));
        }
        return Payload.none();
    }

    private static String requireString(JsonNode node, String field, String nodeId) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isTextual()) {
            String where = nodeId == null ? "" : " in node '" + nodeId + "'";
            throw new GraphDocumentException(
                    "Missing or invalid required field: '" + field + "'" + where, nodeId, null);
        }
        return value.textValue();
    }

    private static List<String> stringList(JsonNode array, String field, String id, String kind) {
        if (array == null || array.isNull()) {
            return List.of();
        }
        if (!array.isArray()) {
            throw new GraphDocumentException("Node '" + id + "': '" + field + "' must be an array", id, kind);
        }
        List<String> result = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            if (!element.isTextual()) {
                throw new GraphDocumentException(
                        "Node '" + id + "': '" + field + "' must contain node ids", id, kind);
            }
            result.add(element.textValue());
        }
        return result;
    }

    /** Converts a JSON value to plain Java data, with every number as a {@link Double}. */
    private static Object toValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isArray()) {
            List<Object> list = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                list.add(toValue(element));
            }
            return list;
        }
        if (node.isObject()) {
            Map<String, Object> map = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> field = it.next();
                map.put(field.getKey(), toValue(field.getValue()));
            }
            return map;
        }
        return node.asText();
    }
}
