package work.lcod.flowguard.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import work.lcod.flowguard.support.FlowFixtures;

class FlowDocumentWriterTest {
    @Test
    void writesTheDocumentShapeBack() {
        var graph = FlowFixtures.load("trigger-action.json");

        var node = FlowDocumentWriter.toNode(graph);

        assertEquals("Trigger to action", node.get("name").asText());
        var first = node.get("nodes").get(0);
        assertEquals("Manual Trigger", first.get("name").asText());
        assertEquals("n8n-nodes-base.manualTrigger", first.get("type").asText());
        assertTrue(first.get("position").get(0).isIntegralNumber());
        assertEquals(250, first.get("position").get(0).intValue());
        var edge = node.get("connections").get("Manual Trigger").get("main").get(0).get(0);
        assertEquals("Set Data", edge.get("node").asText());
        assertEquals("main", edge.get("type").asText());
        assertEquals(0, edge.get("index").intValue());
        assertFalse(node.get("active").booleanValue());
        assertEquals("fixture", node.get("meta").get("instanceId").asText());
    }

    @Test
    void rereadingWrittenDocumentKeepsTheGraph() {
        var graph = FlowFixtures.load("agent-backwards-tool.json");

        var reread = FlowDocumentReader.readJson(FlowDocumentWriter.toPrettyJson(graph)).graph();

        assertEquals(graph.stepNames(), reread.stepNames());
        assertEquals(graph.edges(), reread.edges());
    }
}
