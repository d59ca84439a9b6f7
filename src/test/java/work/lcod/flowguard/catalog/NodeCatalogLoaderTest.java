package work.lcod.flowguard.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NodeCatalogLoaderTest {
    @TempDir
    Path tempDir;

    @Test
    void bundledCatalogDescribesServicesAndTools() {
        var catalog = NodeCatalogLoader.bundled();

        var gmail = catalog.lookup("n8n-nodes-base.gmail").orElseThrow();
        assertEquals("Gmail", gmail.displayName());
        assertTrue(gmail.requiresCredentials());
        assertEquals("gmailOAuth2", gmail.credentialKind());
        assertEquals(Optional.of("n8n-nodes-base.gmailTool"), gmail.toolEquivalent());
        assertEquals(Optional.of("tool"), catalog.lookup("n8n-nodes-base.gmailTool").orElseThrow().role());
        assertFalse(catalog.lookup("n8n-nodes-base.httpRequest").orElseThrow().requiresCredentials());
        assertSame(catalog, NodeCatalogLoader.bundled());
    }

    @Test
    void parsesInlineTables() {
        var catalog = NodeCatalogLoader.parse("""
            [kinds."acme.crm"]
            displayName = "Acme CRM"
            requiresCredentials = true
            credentialKind = "acmeApi"
            toolEquivalent = " acme.crmTool "

            [kinds."acme.crmTool"]
            role = "tool"
            """);

        assertEquals(2, catalog.size());
        var crm = catalog.lookup("acme.crm").orElseThrow();
        assertEquals("acmeApi", crm.credentialKind());
        assertEquals(Optional.of("acme.crmTool"), crm.toolEquivalent());
        var tool = catalog.lookup("acme.crmTool").orElseThrow();
        assertEquals("", tool.displayName());
        assertFalse(tool.requiresCredentials());
        assertTrue(catalog.lookup("acme.unknown").isEmpty());
        assertTrue(catalog.lookup(null).isEmpty());
    }

    @Test
    void emptyDocumentGivesEmptyCatalog() {
        assertEquals(0, NodeCatalogLoader.parse("").size());
        assertEquals(0, NodeCatalogLoader.parse("title = \"nothing here\"").size());
    }

    @Test
    void rejectsInvalidDocuments() {
        var syntax = assertThrows(IllegalArgumentException.class, () -> NodeCatalogLoader.parse("[kinds\nbroken"));
        assertTrue(syntax.getMessage().startsWith("Invalid node catalog <inline>"));
        assertThrows(IllegalArgumentException.class, () -> NodeCatalogLoader.parse("[kinds]\n\"acme.crm\" = 3"));
        assertThrows(IllegalArgumentException.class, () -> NodeCatalogLoader.load(tempDir.resolve("missing.toml")));
    }

    @Test
    void loadedCatalogOverridesBundledEntries() throws Exception {
        var file = tempDir.resolve("catalog.toml");
        Files.writeString(file, """
            [kinds."n8n-nodes-base.gmail"]
            displayName = "Company Mail"
            """);

        var merged = NodeCatalogLoader.bundled().merge(NodeCatalogLoader.load(file));

        assertEquals(NodeCatalogLoader.bundled().size(), merged.size());
        var gmail = merged.lookup("n8n-nodes-base.gmail").orElseThrow();
        assertEquals("Company Mail", gmail.displayName());
        assertFalse(gmail.requiresCredentials());
        assertTrue(merged.lookup("n8n-nodes-base.slack").isPresent());
    }

    @Test
    void entryBuildersKeepOtherFields() {
        var entry = CatalogEntry.of("acme.crm", "Acme").withCredentials("acmeApi").withToolEquivalent("acme.crmTool");

        assertTrue(entry.requiresCredentials());
        assertEquals("Acme", entry.displayName());
        assertEquals(Optional.of("acme.crmTool"), entry.toolEquivalent());
        assertEquals(Optional.of("agent"), entry.withRole("agent").role());
        assertTrue(NodeCatalog.empty().lookup("acme.crm").isEmpty());
    }
}
