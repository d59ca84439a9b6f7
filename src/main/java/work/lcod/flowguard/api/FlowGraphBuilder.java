package work.lcod.flowguard.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import work.lcod.flowguard.catalog.NodeCatalog;
import work.lcod.flowguard.graph.Edge;
import work.lcod.flowguard.graph.FlowGraph;
import work.lcod.flowguard.graph.PortKind;
import work.lcod.flowguard.graph.Position;
import work.lcod.flowguard.graph.Step;
import work.lcod.flowguard.policy.CredentialPlaceholders;
import work.lcod.flowguard.policy.PortKindPolicy;
import work.lcod.flowguard.policy.StepNames;

/**
 * Builds a candidate graph step by step. Steps get descriptive unique names and, unless a
 * position is given, are laid out left to right from {@code (250, 300)}.
 */
public final class FlowGraphBuilder {
    static final double START_X = 250;
    static final double START_Y = 300;
    static final double STEP_X = 200;

    private final PortKindPolicy policy;
    private final StepNames names;
    private final FlowGraph graph;
    private double nextX = START_X;

    public FlowGraphBuilder(NodeCatalog catalog) {
        this(catalog, null);
    }

    public FlowGraphBuilder(NodeCatalog catalog, String workflowName) {
        this.policy = new PortKindPolicy(catalog);
        this.names = new StepNames(policy);
        this.graph = new FlowGraph(workflowName);
    }

    public String addStep(String kind, Map<String, Object> parameters) {
        return addStep(kind, parameters, null);
    }

    /**
     * @return the name assigned to the new step, used to address it in {@link #connect}
     */
    public String addStep(String kind, Map<String, Object> parameters, Position position) {
        Objects.requireNonNull(kind, "kind");
        var name = StepNames.uniquify(names.descriptiveName(kind), graph.stepNames());
        var placed = position;
        if (placed == null) {
            placed = new Position(nextX, START_Y);
            nextX += STEP_X;
        }
        var step = new Step(
            UUID.randomUUID().toString(),
            name,
            kind,
            1,
            placed,
            parameters == null ? new LinkedHashMap<>() : parameters,
            CredentialPlaceholders.forKind(kind, policy, names).orElse(null),
            null
        );
        graph.addStep(step);
        return name;
    }

    public FlowGraphBuilder connect(String source, String target) {
        return connect(source, target, PortKind.MAIN, 0, 0);
    }

    public FlowGraphBuilder connect(String source, String target, PortKind portKind) {
        return connect(source, target, portKind, 0, 0);
    }

    public FlowGraphBuilder connect(String source, String target, PortKind portKind, int sourceIndex, int targetIndex) {
        requireStep(source);
        requireStep(target);
        graph.addEdge(new Edge(source, portKind, sourceIndex, target, targetIndex));
        return this;
    }

    /**
     * Snapshot of the graph built so far; further changes to the builder do not affect it.
     */
    public FlowGraph build() {
        return graph.deepCopy();
    }

    private void requireStep(String name) {
        if (graph.step(name).isEmpty()) {
            throw new IllegalArgumentException("Unknown step: " + name);
        }
    }
}
