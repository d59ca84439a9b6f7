package work.lcod.flowguard.repair;

import java.util.ArrayList;
import java.util.List;
import work.lcod.flowguard.graph.Step;
import work.lcod.flowguard.policy.StepRole;

/**
 * Retypes regular service steps that sit outside the main chain to their tool variant when
 * the graph has an agent that could use them.
 */
final class PromoteToolEquivalentsPass implements RepairPass {
    static final String ID = "promote-tool-equivalents";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<String> apply(RepairContext context) {
        if (context.graph().steps().stream().noneMatch(context.policy()::isAgent)) {
            return List.of();
        }
        var fixes = new ArrayList<String>();
        for (var step : context.graph().steps()) {
            if (context.role(step) != StepRole.REGULAR) {
                continue;
            }
            var equivalent = context.policy().toolEquivalent(step.kind());
            if (equivalent.isEmpty() || !isOffMainChain(context, step)) {
                continue;
            }
            var oldKind = step.kind();
            step.setKind(equivalent.get());
            fixes.add("Converted step " + context.label(step) + " from \"" + oldKind + "\" to tool variant \""
                + equivalent.get() + "\"");
        }
        return fixes;
    }

    private static boolean isOffMainChain(RepairContext context, Step step) {
        if (!step.hasName()) {
            return true;
        }
        var graph = context.graph();
        for (var edge : graph.outgoing(step.name())) {
            if (!edge.portKind().isAgentInfrastructure()) {
                return false;
            }
        }
        for (var edge : graph.incoming(step.name())) {
            if (!edge.portKind().isAgentInfrastructure()) {
                return false;
            }
        }
        return true;
    }
}
