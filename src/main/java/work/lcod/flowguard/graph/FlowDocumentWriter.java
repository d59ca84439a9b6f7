package work.lcod.flowguard.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Serialises a {@link FlowGraph} back into the workflow document shape the reader accepts.
 */
public final class FlowDocumentWriter {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectWriter PRETTY = JSON.writerWithDefaultPrettyPrinter();

    private FlowDocumentWriter() {}

    public static ObjectNode toNode(FlowGraph graph) {
        var root = JSON.createObjectNode();
        if (graph.name() != null) {
            root.put("name", graph.name());
        }
        var nodes = root.putArray("nodes");
        for (var step : graph.steps()) {
            nodes.add(stepNode(step));
        }
        var connections = root.putObject("connections");
        for (var sourceEntry : graph.connections().entrySet()) {
            var ports = connections.putObject(sourceEntry.getKey());
            for (var portEntry : sourceEntry.getValue().entrySet()) {
                var slots = ports.putArray(portEntry.getKey().wireName());
                for (var slot : portEntry.getValue()) {
                    var slotNode = slots.addArray();
                    for (var edge : slot) {
                        var edgeNode = slotNode.addObject();
                        edgeNode.put("node", edge.target());
                        edgeNode.put("type", edge.portKind().wireName());
                        edgeNode.put("index", edge.targetIndex());
                    }
                }
            }
        }
        if (graph.active() != null) {
            root.put("active", graph.active());
        }
        if (graph.settings() != null) {
            root.set("settings", JSON.valueToTree(graph.settings()));
        }
        for (var extra : graph.extras().entrySet()) {
            root.set(extra.getKey(), JSON.valueToTree(extra.getValue()));
        }
        return root;
    }

    public static String toPrettyJson(FlowGraph graph) {
        try {
            return PRETTY.writeValueAsString(toNode(graph));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize workflow: " + ex.getMessage(), ex);
        }
    }

    private static ObjectNode stepNode(Step step) {
        var node = JSON.createObjectNode();
        if (step.id() != null) {
            node.put("id", step.id());
        }
        if (step.name() != null) {
            node.put("name", step.name());
        }
        if (step.kind() != null) {
            node.put("type", step.kind());
        }
        if (step.kindVersion() != null) {
            node.set("typeVersion", JSON.valueToTree(step.kindVersion()));
        }
        if (step.position() != null) {
            ArrayNode position = node.putArray("position");
            addCoordinate(position, step.position().x());
            addCoordinate(position, step.position().y());
        }
        if (step.parameters() != null) {
            node.set("parameters", JSON.valueToTree(step.parameters()));
        }
        if (step.credentials() != null) {
            node.set("credentials", JSON.valueToTree(step.credentials()));
        }
        for (var extra : step.extras().entrySet()) {
            node.set(extra.getKey(), JSON.valueToTree(extra.getValue()));
        }
        return node;
    }

    private static void addCoordinate(ArrayNode array, double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < Long.MAX_VALUE) {
            array.add((long) value);
        } else {
            array.add(value);
        }
    }
}
