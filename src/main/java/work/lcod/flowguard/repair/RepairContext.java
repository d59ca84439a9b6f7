package work.lcod.flowguard.repair;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.lcod.flowguard.analysis.ConnectivityAnalyzer;
import work.lcod.flowguard.api.ValidationOptions;
import work.lcod.flowguard.graph.FlowGraph;
import work.lcod.flowguard.graph.Step;
import work.lcod.flowguard.policy.PortKindPolicy;
import work.lcod.flowguard.policy.StepNames;
import work.lcod.flowguard.policy.StepRole;

/**
 * Working state shared by the passes of one pipeline run: the private graph copy plus the
 * read-only collaborators the passes consult.
 */
public final class RepairContext {
    private final FlowGraph graph;
    private final PortKindPolicy policy;
    private final StepNames names;
    private final ConnectivityAnalyzer analyzer;
    private final ValidationOptions options;

    public RepairContext(FlowGraph graph, PortKindPolicy policy, ValidationOptions options) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.options = Objects.requireNonNull(options, "options");
        this.names = new StepNames(policy);
        this.analyzer = new ConnectivityAnalyzer(policy);
    }

    public FlowGraph graph() {
        return graph;
    }

    public PortKindPolicy policy() {
        return policy;
    }

    public StepNames names() {
        return names;
    }

    public ConnectivityAnalyzer analyzer() {
        return analyzer;
    }

    public ValidationOptions options() {
        return options;
    }

    public StepRole role(Step step) {
        return policy.role(step);
    }

    /**
     * Named steps of one role in declaration order.
     */
    public List<Step> stepsWithRole(StepRole role) {
        var matches = new ArrayList<Step>();
        for (var step : graph.steps()) {
            if (step.hasName() && policy.role(step) == role) {
                matches.add(step);
            }
        }
        return matches;
    }

    public Optional<Step> firstAgent() {
        return stepsWithRole(StepRole.AGENT).stream().findFirst();
    }

    /**
     * Label for fix messages; unnamed steps are identified by their index.
     */
    public String label(Step step) {
        if (step.hasName()) {
            return "\"" + step.name() + "\"";
        }
        return "at index " + graph.steps().indexOf(step);
    }
}
