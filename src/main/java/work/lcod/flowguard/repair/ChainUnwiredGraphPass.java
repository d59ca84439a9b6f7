package work.lcod.flowguard.repair;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import work.lcod.flowguard.graph.Edge;
import work.lcod.flowguard.graph.Step;
import work.lcod.flowguard.policy.StepRole;

/**
 * Wires a graph that has no edges at all into one sequential main chain starting at its
 * first trigger.
 */
final class ChainUnwiredGraphPass implements RepairPass {
    static final String ID = "chain-unwired-graph";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<String> apply(RepairContext context) {
        var graph = context.graph();
        if (graph.edgeCount() > 0 || graph.steps().size() < 2) {
            return List.of();
        }
        var triggers = context.stepsWithRole(StepRole.TRIGGER);
        if (triggers.isEmpty()) {
            return List.of();
        }
        var trigger = triggers.get(0);
        var chain = new LinkedHashSet<String>();
        chain.add(trigger.name());
        for (var step : graph.steps()) {
            if (step.hasName() && isMainChain(context, step)) {
                chain.add(step.name());
            }
        }
        if (chain.size() < 2) {
            return List.of();
        }
        var ordered = new ArrayList<>(chain);
        for (int i = 0; i + 1 < ordered.size(); i++) {
            graph.addEdge(Edge.main(ordered.get(i), ordered.get(i + 1)));
        }
        return List.of("Created sequential connections: " + String.join(" -> ", ordered));
    }

    private static boolean isMainChain(RepairContext context, Step step) {
        var role = context.role(step);
        return role == StepRole.REGULAR || role == StepRole.ROUTER || role == StepRole.AGENT;
    }
}
