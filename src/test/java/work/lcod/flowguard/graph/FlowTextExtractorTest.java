package work.lcod.flowguard.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import work.lcod.flowguard.support.FlowFixtures;

class FlowTextExtractorTest {
    private static final String WORKFLOW = "{\"name\": \"%s\", \"nodes\": [], \"connections\": {}}";

    @Test
    void prefersWorkflowBlockOverPlainJsonBlocks() {
        var root = FlowTextExtractor.extract(FlowFixtures.text("generated-answer.md"));

        assertEquals("Trigger to action", root.get("name").asText());
        assertEquals(2, root.get("nodes").size());
    }

    @Test
    void jsonBlockMentioningNodesBeatsShorterSettingsBlock() {
        var text = "```json\n{\"retries\": 3}\n```\nand\n```JSON\n" + WORKFLOW.formatted("picked") + "\n```";

        assertEquals("picked", FlowTextExtractor.extract(text).get("name").asText());
    }

    @Test
    void fallsBackToBareObject() {
        var text = "Sure! " + WORKFLOW.formatted("bare") + " Let me know if it works.";

        assertEquals("bare", FlowTextExtractor.extract(text).get("name").asText());
    }

    @Test
    void malformedBlockIsReportedSeparately() {
        var text = "```WORKFLOW_JSON\n{\"nodes\": [ {\"name\": \"A\" \n```";

        var thrown = assertThrows(FatalInputException.class, () -> FlowTextExtractor.extract(text));

        assertEquals("malformed_workflow_block", thrown.code());
    }

    @Test
    void textWithoutWorkflowIsRejected() {
        assertEquals("no_workflow_found", code("Nothing to see here."));
        assertEquals("no_workflow_found", code("```json\n{\"retries\": 3}\n```"));
        assertEquals("no_workflow_found", code("   "));
        assertEquals("no_workflow_found", code(null));
    }

    @Test
    void readerBuildsGraphFromExtractedBlock() {
        var graph = FlowDocumentReader.readText(FlowFixtures.text("generated-answer.md")).graph();

        assertEquals(Edge.main("Manual Trigger", "Set Data"), graph.edges().get(0));
    }

    private static String code(String text) {
        return assertThrows(FatalInputException.class, () -> FlowTextExtractor.extract(text)).code();
    }
}
