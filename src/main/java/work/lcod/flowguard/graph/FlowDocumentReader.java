package work.lcod.flowguard.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns workflow documents ({@code {name, nodes, connections, ...}}) into {@link FlowGraph}s.
 *
 * <p>Structural problems a repair pass can deal with (missing names, positions, parameters)
 * are kept on the graph for the validator. Anything that cannot be read as a key-value
 * structure at all raises {@link FatalInputException}.
 */
public final class FlowDocumentReader {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final Set<String> STEP_FIELDS = Set.of(
        "id", "name", "type", "typeVersion", "position", "parameters", "credentials"
    );
    private static final Set<String> GRAPH_FIELDS = Set.of("name", "nodes", "connections", "active", "settings");

    private FlowDocumentReader() {}

    /**
     * Graph read from a document plus non-fatal notices about content that was dropped.
     */
    public record ParsedDocument(FlowGraph graph, List<String> notices) {
        public ParsedDocument {
            notices = List.copyOf(notices);
        }
    }

    public static ParsedDocument readJson(String text) {
        return read(parseTree(JSON, text));
    }

    /**
     * Reads the workflow embedded in free text; see {@link FlowTextExtractor}.
     */
    public static ParsedDocument readText(String text) {
        return read(FlowTextExtractor.extract(text));
    }

    public static ParsedDocument readPath(Path path) {
        var mapper = isYaml(path) ? YAML : JSON;
        try (var in = Files.newInputStream(path)) {
            return read(parseTree(mapper, in));
        } catch (IOException ex) {
            throw new FatalInputException("unreadable_document", "Failed to read workflow document: " + path, ex);
        }
    }

    public static ParsedDocument read(InputStream in) {
        return read(parseTree(YAML, in));
    }

    public static ParsedDocument read(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new FatalInputException("not_an_object", "Invalid workflow format - not a valid JSON object");
        }
        var notices = new ArrayList<String>();
        var graph = new FlowGraph(textOrNull(root.get("name")));

        var nodes = root.get("nodes");
        if (nodes == null || !nodes.isArray()) {
            throw new FatalInputException("missing_nodes", "Workflow must have a nodes array");
        }
        for (int index = 0; index < nodes.size(); index++) {
            graph.addStep(readStep(nodes.get(index), index));
        }

        readConnections(root.get("connections"), graph, notices);

        var active = root.get("active");
        if (active != null && active.isBoolean()) {
            graph.setActive(active.booleanValue());
        }
        var settings = root.get("settings");
        if (settings != null && settings.isObject()) {
            graph.setSettings(JsonValues.objectFromNode(settings));
        }
        var fields = root.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            if (!GRAPH_FIELDS.contains(entry.getKey())) {
                graph.extras().put(entry.getKey(), JsonValues.fromNode(entry.getValue()));
            }
        }
        return new ParsedDocument(graph, notices);
    }

    private static Step readStep(JsonNode node, int index) {
        if (node == null || !node.isObject()) {
            throw new FatalInputException(
                "step_not_object",
                "Step at index " + index + " is not a valid object - workflow JSON is malformed"
            );
        }
        var name = textOrNull(node.get("name"));
        var label = name != null ? "\"" + name + "\"" : "at index " + index;
        var parameters = readOptionalObject(node.get("parameters"), "Step " + label + " has malformed parameters");
        var credentials = readOptionalObject(node.get("credentials"), "Step " + label + " has malformed credentials");

        var extras = new LinkedHashMap<String, Object>();
        var fields = node.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            if (!STEP_FIELDS.contains(entry.getKey())) {
                extras.put(entry.getKey(), JsonValues.fromNode(entry.getValue()));
            }
        }
        var version = node.get("typeVersion");
        return new Step(
            textOrNull(node.get("id")),
            name,
            textOrNull(node.get("type")),
            version != null && version.isNumber() ? version.numberValue() : null,
            readPosition(node.get("position")),
            parameters,
            credentials,
            extras
        );
    }

    private static Map<String, Object> readOptionalObject(JsonNode node, String failure) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new FatalInputException("malformed_map", failure);
        }
        return JsonValues.objectFromNode(node);
    }

    private static Position readPosition(JsonNode node) {
        if (node == null || !node.isArray() || node.size() != 2) {
            return null;
        }
        if (!node.get(0).isNumber() || !node.get(1).isNumber()) {
            return null;
        }
        return new Position(node.get(0).doubleValue(), node.get(1).doubleValue());
    }

    private static void readConnections(JsonNode node, FlowGraph graph, List<String> notices) {
        if (node == null || node.isNull()) {
            return;
        }
        if (!node.isObject()) {
            throw new FatalInputException("malformed_connections", "Workflow connections must be an object");
        }
        var sources = node.fields();
        while (sources.hasNext()) {
            var sourceEntry = sources.next();
            var source = sourceEntry.getKey();
            var ports = sourceEntry.getValue();
            if (ports == null || ports.isNull()) {
                continue;
            }
            if (!ports.isObject()) {
                throw new FatalInputException("malformed_connections", "Connections of \"" + source + "\" must be an object");
            }
            var portFields = ports.fields();
            while (portFields.hasNext()) {
                var portEntry = portFields.next();
                var portKind = PortKind.fromWire(portEntry.getKey());
                if (portKind.isEmpty()) {
                    notices.add("Dropped unsupported connection type \"" + portEntry.getKey() + "\" from \"" + source + "\"");
                    continue;
                }
                readSlots(source, portKind.get(), portEntry.getValue(), graph);
            }
        }
    }

    private static void readSlots(String source, PortKind portKind, JsonNode slots, FlowGraph graph) {
        if (slots == null || slots.isNull()) {
            return;
        }
        if (!slots.isArray()) {
            throw malformedConnection(source, portKind);
        }
        for (int slotIndex = 0; slotIndex < slots.size(); slotIndex++) {
            var slot = slots.get(slotIndex);
            if (slot == null || slot.isNull()) {
                continue;
            }
            if (!slot.isArray()) {
                throw malformedConnection(source, portKind);
            }
            for (var entry : slot) {
                if (entry == null || !entry.isObject()) {
                    throw malformedConnection(source, portKind);
                }
                var target = textOrNull(entry.get("node"));
                if (target == null) {
                    throw malformedConnection(source, portKind);
                }
                graph.addEdge(new Edge(source, portKind, slotIndex, target, readIndex(entry.get("index"), source, portKind)));
            }
        }
    }

    private static int readIndex(JsonNode node, String source, PortKind portKind) {
        if (node == null || node.isNull()) {
            return 0;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt() || node.intValue() < 0) {
            throw malformedConnection(source, portKind);
        }
        return node.intValue();
    }

    private static FatalInputException malformedConnection(String source, PortKind portKind) {
        return new FatalInputException(
            "malformed_connections",
            "Connection \"" + portKind.wireName() + "\" from \"" + source + "\" is malformed"
        );
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return null;
        }
        return node.asText();
    }

    private static JsonNode parseTree(ObjectMapper mapper, String text) {
        if (text == null || text.isBlank()) {
            throw new FatalInputException("not_an_object", "Invalid workflow format - empty document");
        }
        try {
            return mapper.readTree(text);
        } catch (JsonProcessingException ex) {
            throw new FatalInputException("unparseable_document", "Workflow document is not valid JSON: " + ex.getOriginalMessage(), ex);
        }
    }

    private static JsonNode parseTree(ObjectMapper mapper, InputStream in) {
        try {
            return mapper.readTree(in);
        } catch (IOException ex) {
            throw new FatalInputException("unparseable_document", "Workflow document cannot be parsed: " + ex.getMessage(), ex);
        }
    }

    private static boolean isYaml(Path path) {
        var fileName = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".yaml") || fileName.endsWith(".yml");
    }
}
