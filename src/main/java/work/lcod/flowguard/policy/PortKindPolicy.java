package work.lcod.flowguard.policy;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import work.lcod.flowguard.catalog.CatalogEntry;
import work.lcod.flowguard.catalog.NodeCatalog;
import work.lcod.flowguard.graph.PortKind;
import work.lcod.flowguard.graph.Step;

/**
 * Classifies step kinds and answers which port kinds they may use.
 *
 * <p>The catalog is consulted first; kinds it does not know are classified from naming
 * conventions of the execution engine ({@code ...Trigger}, {@code ...Tool}, {@code lmChat...}).
 * Instances are immutable and can be shared.
 */
public final class PortKindPolicy {
    public static final String DECORATIVE_KIND = "n8n-nodes-base.stickyNote";

    private static final Map<String, String> DEPRECATED_KINDS = Map.of(
        "@n8n/n8n-nodes-langchain.openAi", "@n8n/n8n-nodes-langchain.lmChatOpenAi",
        "@n8n/n8n-nodes-langchain.chatOpenAi", "@n8n/n8n-nodes-langchain.lmChatOpenAi"
    );

    private static final Set<String> TOOL_SERVICES = Set.of(
        "gmail", "googleSheets", "slack", "notion", "airtable", "github", "googleDrive", "hubspot",
        "salesforce", "jira", "trello", "asana", "linear", "discord", "telegram", "httpRequest"
    );
    private static final String SERVICE_PREFIX = "n8n-nodes-base.";

    private static final Set<String> TRIGGER_NAMES = Set.of("webhook", "cron", "schedule", "interval");
    private static final Set<String> ROUTER_NAMES = Set.of("if", "switch");

    private final NodeCatalog catalog;

    public PortKindPolicy(NodeCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public NodeCatalog catalog() {
        return catalog;
    }

    public Optional<CatalogEntry> entry(String kind) {
        if (kind == null || kind.isBlank()) {
            return Optional.empty();
        }
        return catalog.lookup(kind);
    }

    public StepRole role(Step step) {
        return role(step.kind());
    }

    public StepRole role(String kind) {
        if (kind == null || kind.isBlank()) {
            return StepRole.REGULAR;
        }
        var declared = entry(kind).flatMap(CatalogEntry::role).flatMap(StepRole::fromName);
        if (declared.isPresent()) {
            return declared.get();
        }
        var canonical = canonicalKind(kind);
        if (canonical.isPresent()) {
            return role(canonical.get());
        }
        return conventionalRole(kind);
    }

    public boolean isTrigger(Step step) {
        return role(step) == StepRole.TRIGGER;
    }

    public boolean isAgent(Step step) {
        return role(step) == StepRole.AGENT;
    }

    public boolean isToolCapable(Step step) {
        return role(step) == StepRole.TOOL;
    }

    public boolean isLanguageModel(Step step) {
        return role(step) == StepRole.LANGUAGE_MODEL;
    }

    public boolean isMemory(Step step) {
        return role(step) == StepRole.MEMORY;
    }

    public boolean isRouter(Step step) {
        return role(step) == StepRole.ROUTER;
    }

    public boolean isDecorative(Step step) {
        return role(step) == StepRole.DECORATIVE;
    }

    public boolean allowsOutbound(Step step, PortKind portKind) {
        return role(step).emits(portKind);
    }

    public boolean allowsInbound(Step step, PortKind portKind) {
        return role(step).accepts(portKind);
    }

    /**
     * Kind exposing the same service as an agent tool, from the catalog or the built-in
     * service table.
     */
    public Optional<String> toolEquivalent(String kind) {
        if (kind == null || kind.isBlank()) {
            return Optional.empty();
        }
        var fromCatalog = entry(kind).flatMap(CatalogEntry::toolEquivalent);
        if (fromCatalog.isPresent()) {
            return fromCatalog;
        }
        if (kind.startsWith(SERVICE_PREFIX) && TOOL_SERVICES.contains(localName(kind))) {
            return Optional.of(kind + "Tool");
        }
        return Optional.empty();
    }

    /**
     * Successor of a deprecated kind; empty when the kind is current.
     */
    public Optional<String> canonicalKind(String kind) {
        if (kind == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(DEPRECATED_KINDS.get(kind));
    }

    /**
     * Part of a kind after its package prefix: {@code n8n-nodes-base.gmail -> gmail}.
     */
    public static String localName(String kind) {
        if (kind == null) {
            return "";
        }
        int dot = kind.lastIndexOf('.');
        return dot >= 0 ? kind.substring(dot + 1) : kind;
    }

    static StepRole conventionalRole(String kind) {
        if (DECORATIVE_KIND.equals(kind)) {
            return StepRole.DECORATIVE;
        }
        var local = localName(kind);
        if (local.startsWith("tool") || local.endsWith("Tool")) {
            return StepRole.TOOL;
        }
        if (local.equals("agent")) {
            return StepRole.AGENT;
        }
        if (local.startsWith("lmChat") || local.contains("ChatModel")) {
            return StepRole.LANGUAGE_MODEL;
        }
        if (local.startsWith("memory")) {
            return StepRole.MEMORY;
        }
        if (local.toLowerCase(Locale.ROOT).contains("trigger") || TRIGGER_NAMES.contains(local)) {
            return StepRole.TRIGGER;
        }
        if (ROUTER_NAMES.contains(local)) {
            return StepRole.ROUTER;
        }
        return StepRole.REGULAR;
    }
}
