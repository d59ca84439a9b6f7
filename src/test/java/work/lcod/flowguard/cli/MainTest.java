package work.lcod.flowguard.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.flowguard.graph.FlowDocumentReader;
import work.lcod.flowguard.graph.Position;
import work.lcod.flowguard.support.FlowFixtures;

class MainTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        var commandLine = Main.commandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    @Test
    void validatePrintsReportAndSucceedsForValidDocument() throws Exception {
        int exit = run("validate", FlowFixtures.resource("trigger-action.json").toString());

        assertEquals(0, exit, err::toString);
        JsonNode report = JSON.readTree(out.toString());
        assertTrue(report.get("source").asText().endsWith("trigger-action.json"));
        assertTrue(report.get("valid").booleanValue());
        assertEquals(0, report.get("fixes").size());
    }

    @Test
    void validateExitsWithOneWhenErrorsRemain() throws Exception {
        int exit = run("validate", FlowFixtures.resource("generic-orphan.json").toString());

        assertEquals(1, exit);
        var report = JSON.readTree(out.toString());
        assertFalse(report.get("valid").booleanValue());
        assertTrue(report.get("autofixed").booleanValue());
    }

    @Test
    void extractValidatesWorkflowBlockInText() throws Exception {
        int exit = run("validate", "--extract", FlowFixtures.resource("generated-answer.md").toString());

        assertEquals(0, exit, err::toString);
        var report = JSON.readTree(out.toString());
        assertTrue(report.get("valid").booleanValue());
    }

    @Test
    void extractFailsWhenTextHoldsNoWorkflow() throws Exception {
        var notes = tempDir.resolve("notes.txt");
        Files.writeString(notes, "Just some prose.");

        int exit = run("validate", "--extract", notes.toString());

        assertEquals(1, exit);
        var report = JSON.readTree(out.toString());
        assertEquals("No workflow document found in the text", report.get("errors").get(0).asText());
    }

    @Test
    void noRepairSkipsThePipeline() throws Exception {
        int exit = run("validate", "--no-repair", FlowFixtures.resource("agent-backwards-tool.json").toString());

        assertEquals(1, exit);
        var report = JSON.readTree(out.toString());
        assertEquals(0, report.get("fixes").size());
        assertFalse(report.get("autofixed").booleanValue());
    }

    @Test
    void outputWritesNormalizedDocument() throws Exception {
        var target = tempDir.resolve("out/fixed.json");

        int exit = run("validate", "-o", target.toString(), FlowFixtures.resource("agent-backwards-tool.json").toString());

        assertEquals(0, exit, err::toString);
        var graph = FlowDocumentReader.readPath(target).graph();
        assertEquals(new Position(450, 600), graph.step("Code Tool").orElseThrow().position());
    }

    @Test
    void configFileDisablesPasses() throws Exception {
        var config = tempDir.resolve("flowguard.toml");
        Files.writeString(config, "[repair]\ndisabledPasses = [\"prune-fanout\"]\n");

        int exit = run("validate", "--config", config.toString(), FlowFixtures.resource("fanout-chain.json").toString());

        assertEquals(0, exit, err::toString);
        var report = JSON.readTree(out.toString());
        assertEquals(0, report.get("fixes").size());
        assertTrue(report.get("warnings").toString().contains("fans out to 2 steps"));
    }

    @Test
    void catalogOverrideChangesGeneratedNames() throws Exception {
        var catalog = tempDir.resolve("catalog.toml");
        Files.writeString(catalog, "[kinds.\"n8n-nodes-base.noOp\"]\ndisplayName = \"Pass Through\"\n");
        var document = tempDir.resolve("flow.json");
        Files.writeString(document, """
            {"nodes": [
              {"name": "Start", "type": "n8n-nodes-base.manualTrigger", "position": [0, 0], "parameters": {}},
              {"name": "Node2", "type": "n8n-nodes-base.noOp", "position": [200, 0], "parameters": {}}
            ], "connections": {"Start": {"main": [[{"node": "Node2", "type": "main", "index": 0}]]}}}
            """);

        int exit = run("validate", "--catalog", catalog.toString(), document.toString());

        assertEquals(0, exit, err::toString);
        var report = JSON.readTree(out.toString());
        assertEquals("Pass Through", report.get("normalized").get("nodes").get(1).get("name").asText());
    }

    @Test
    void analyzePrintsConnectivity() throws Exception {
        int exit = run("analyze", FlowFixtures.resource("fanout-chain.json").toString());

        assertEquals(0, exit, err::toString);
        var summary = JSON.readTree(out.toString());
        assertEquals(10, summary.get("steps").intValue());
        assertEquals(2, summary.get("maxFanout").intValue());
        assertEquals(0, summary.get("orphans").size());
    }

    @Test
    void analyzeReportsUnreadableDocumentsOnOneLine() {
        int exit = run("analyze", FlowFixtures.resource("malformed-parameters.json").toString());

        assertEquals(1, exit);
        assertTrue(err.toString().contains("Step \"Broken\" has malformed parameters [malformed_map]"));
    }

    @Test
    void usageErrorsExitWithTwo() {
        assertEquals(2, run());
        assertEquals(2, run("validate", tempDir.resolve("missing.json").toString()));
        assertEquals(2, run("validate", "-o", tempDir.resolve("x.json").toString(),
            FlowFixtures.resource("trigger-action.json").toString(),
            FlowFixtures.resource("fanout-chain.json").toString()));
    }

    @Test
    void versionMentionsTheTool() {
        assertEquals(0, run("--version"));
        assertTrue(out.toString().startsWith("flowguard "));
    }
}
