package work.lcod.flowguard.policy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.lcod.flowguard.catalog.CatalogEntry;
import work.lcod.flowguard.catalog.NodeCatalog;
import work.lcod.flowguard.support.FlowFixtures;

class StepNamesTest {
    private final StepNames names = new StepNames(FlowFixtures.policy());

    @Test
    void recognisesGenericNames() {
        assertTrue(StepNames.isGeneric("Node1"));
        assertTrue(StepNames.isGeneric("node 12"));
        assertTrue(StepNames.isGeneric(" NODE3 "));
        assertFalse(StepNames.isGeneric("Node"));
        assertFalse(StepNames.isGeneric("Node 1 copy"));
        assertFalse(StepNames.isGeneric("HTTP Request"));
        assertFalse(StepNames.isGeneric(null));
    }

    @Test
    void prefersKnownNamesThenCatalogNames() {
        assertEquals("HTTP Request", names.descriptiveName(FlowFixtures.HTTP_REQUEST));
        assertEquals("Set Data", names.descriptiveName(FlowFixtures.SET));
        assertEquals("Webhook Trigger", names.descriptiveName(FlowFixtures.WEBHOOK));
        assertEquals("OpenAI Chat Model", names.descriptiveName(FlowFixtures.OPENAI_MODEL));
        assertEquals("Gmail Tool", names.descriptiveName(FlowFixtures.GMAIL_TOOL));
    }

    @Test
    void fallsBackToHintsAndTitleCase() {
        var bare = new StepNames(new PortKindPolicy(NodeCatalog.empty()));

        assertEquals("Split Data", bare.descriptiveName("acme.splitOut"));
        assertEquals("Send Email", bare.descriptiveName("acme.emailSend"));
        assertEquals("File Operation", bare.descriptiveName("acme.readBinaryFiles"));
        assertEquals("Order Sync", bare.descriptiveName("acme.orderSync"));
        assertEquals("Step", bare.descriptiveName(null));
        assertEquals("Step", bare.descriptiveName("acme.node7"));
    }

    @Test
    void catalogDisplayNamesCanBeGenericToo() {
        NodeCatalog catalog = kind -> Optional.of(CatalogEntry.of(kind, "Node 4"));
        var custom = new StepNames(new PortKindPolicy(catalog));

        assertEquals("Step", custom.descriptiveName("acme.mystery"));
    }

    @Test
    void uniquifyAppendsFirstFreeCounter() {
        assertEquals("Gmail", StepNames.uniquify("Gmail", Set.of()));
        assertEquals("Gmail 2", StepNames.uniquify("Gmail", Set.of("Gmail")));
        assertEquals("Gmail 4", StepNames.uniquify("Gmail", Set.of("Gmail", "Gmail 2", "Gmail 3")));
    }

    @Test
    void titleCaseSplitsCamelCaseAndSeparators() {
        Map.of(
            "orderSync", "Order Sync",
            "order_sync", "Order sync",
            "crm", "Crm",
            "", "Step"
        ).forEach((input, expected) -> assertEquals(expected, StepNames.titleCase(input)));
    }
}
