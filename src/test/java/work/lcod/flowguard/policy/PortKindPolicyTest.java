package work.lcod.flowguard.policy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.flowguard.support.FlowFixtures.AGENT;
import static work.lcod.flowguard.support.FlowFixtures.CODE_TOOL;
import static work.lcod.flowguard.support.FlowFixtures.DEPRECATED_OPENAI;
import static work.lcod.flowguard.support.FlowFixtures.GMAIL;
import static work.lcod.flowguard.support.FlowFixtures.GMAIL_TOOL;
import static work.lcod.flowguard.support.FlowFixtures.IF;
import static work.lcod.flowguard.support.FlowFixtures.MEMORY;
import static work.lcod.flowguard.support.FlowFixtures.OPENAI_MODEL;
import static work.lcod.flowguard.support.FlowFixtures.SET;
import static work.lcod.flowguard.support.FlowFixtures.STICKY_NOTE;
import static work.lcod.flowguard.support.FlowFixtures.WEBHOOK;
import static work.lcod.flowguard.support.FlowFixtures.step;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.lcod.flowguard.catalog.CatalogEntry;
import work.lcod.flowguard.catalog.MapNodeCatalog;
import work.lcod.flowguard.catalog.NodeCatalog;
import work.lcod.flowguard.graph.PortKind;
import work.lcod.flowguard.support.FlowFixtures;

class PortKindPolicyTest {
    private final PortKindPolicy policy = FlowFixtures.policy();

    @Test
    void classifiesBundledKinds() {
        assertEquals(StepRole.TRIGGER, policy.role(WEBHOOK));
        assertEquals(StepRole.AGENT, policy.role(AGENT));
        assertEquals(StepRole.LANGUAGE_MODEL, policy.role(OPENAI_MODEL));
        assertEquals(StepRole.MEMORY, policy.role(MEMORY));
        assertEquals(StepRole.TOOL, policy.role(GMAIL_TOOL));
        assertEquals(StepRole.TOOL, policy.role(CODE_TOOL));
        assertEquals(StepRole.ROUTER, policy.role(IF));
        assertEquals(StepRole.DECORATIVE, policy.role(STICKY_NOTE));
        assertEquals(StepRole.REGULAR, policy.role(GMAIL));
        assertEquals(StepRole.REGULAR, policy.role((String) null));
    }

    @Test
    void fallsBackToNamingConventionsWithoutCatalog() {
        var bare = new PortKindPolicy(NodeCatalog.empty());

        assertEquals(StepRole.TRIGGER, bare.role("acme.orderCreatedTrigger"));
        assertEquals(StepRole.TRIGGER, bare.role("acme.cron"));
        assertEquals(StepRole.TOOL, bare.role("acme.toolCalculator"));
        assertEquals(StepRole.TOOL, bare.role("acme.searchTool"));
        assertEquals(StepRole.LANGUAGE_MODEL, bare.role("acme.lmChatMistral"));
        assertEquals(StepRole.LANGUAGE_MODEL, bare.role("acme.mistralChatModel"));
        assertEquals(StepRole.MEMORY, bare.role("acme.memoryRedis"));
        assertEquals(StepRole.AGENT, bare.role("acme.agent"));
        assertEquals(StepRole.ROUTER, bare.role("acme.switch"));
        assertEquals(StepRole.DECORATIVE, bare.role(STICKY_NOTE));
        assertEquals(StepRole.REGULAR, bare.role("acme.crm"));
    }

    @Test
    void catalogRoleWinsOverNamingConventions() {
        var catalog = new MapNodeCatalog(List.of(CatalogEntry.of("acme.toolbox", "Toolbox").withRole("regular")));
        var custom = new PortKindPolicy(catalog);

        assertEquals(StepRole.REGULAR, custom.role("acme.toolbox"));
        assertEquals(StepRole.TOOL, new PortKindPolicy(NodeCatalog.empty()).role("acme.toolbox"));
    }

    @Test
    void deprecatedKindsClassifyAsTheirSuccessor() {
        assertEquals(Optional.of(OPENAI_MODEL), policy.canonicalKind(DEPRECATED_OPENAI));
        assertEquals(StepRole.LANGUAGE_MODEL, policy.role(DEPRECATED_OPENAI));
        assertTrue(policy.canonicalKind(OPENAI_MODEL).isEmpty());
    }

    @Test
    void answersPortPermissionsPerRole() {
        var trigger = step("Hook", WEBHOOK);
        var agent = step("Agent", AGENT);
        var tool = step("Tool", GMAIL_TOOL);
        var note = step("Note", STICKY_NOTE);

        assertTrue(policy.allowsOutbound(trigger, PortKind.MAIN));
        assertFalse(policy.allowsInbound(trigger, PortKind.MAIN));
        assertTrue(policy.allowsInbound(agent, PortKind.TOOL));
        assertTrue(policy.allowsInbound(agent, PortKind.MAIN));
        assertFalse(policy.allowsOutbound(agent, PortKind.TOOL));
        assertTrue(policy.allowsOutbound(tool, PortKind.TOOL));
        assertFalse(policy.allowsOutbound(tool, PortKind.MAIN));
        assertFalse(policy.allowsInbound(note, PortKind.MAIN));
        assertFalse(policy.allowsOutbound(note, PortKind.MAIN));
        assertTrue(policy.isToolCapable(tool));
        assertTrue(policy.isDecorative(note));
    }

    @Test
    void findsToolEquivalents() {
        assertEquals(Optional.of(GMAIL_TOOL), policy.toolEquivalent(GMAIL));
        assertEquals(Optional.of("n8n-nodes-base.jiraTool"), new PortKindPolicy(NodeCatalog.empty()).toolEquivalent("n8n-nodes-base.jira"));
        assertTrue(policy.toolEquivalent(SET).isEmpty());
        assertTrue(policy.toolEquivalent("acme.gmail").isEmpty());
    }

    @Test
    void parsesRoleNames() {
        assertEquals(Optional.of(StepRole.LANGUAGE_MODEL), StepRole.fromName("languageModel"));
        assertEquals(Optional.of(StepRole.LANGUAGE_MODEL), StepRole.fromName("language_model"));
        assertEquals(Optional.of(StepRole.LANGUAGE_MODEL), StepRole.fromName("llm"));
        assertEquals(Optional.of(StepRole.TOOL), StepRole.fromName(" TOOL "));
        assertTrue(StepRole.fromName("plugin").isEmpty());
        assertTrue(StepRole.TOOL.isAgentInfrastructure());
        assertFalse(StepRole.AGENT.isAgentInfrastructure());
    }

    @Test
    void localNameStripsPackagePrefix() {
        assertEquals("gmail", PortKindPolicy.localName(GMAIL));
        assertEquals("agent", PortKindPolicy.localName(AGENT));
        assertEquals("plain", PortKindPolicy.localName("plain"));
        assertEquals("", PortKindPolicy.localName(null));
    }
}
