package work.lcod.flowguard.repair;

import java.util.ArrayList;
import java.util.List;
import work.lcod.flowguard.graph.Edge;
import work.lcod.flowguard.graph.PortKind;

/**
 * Turns agent to tool edges around into the canonical tool to agent direction.
 */
final class ReverseToolEdgesPass implements RepairPass {
    static final String ID = "reverse-tool-edges";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<String> apply(RepairContext context) {
        var graph = context.graph();
        var policy = context.policy();
        var backwards = graph.removeEdges(edge -> edge.portKind() == PortKind.TOOL
            && graph.step(edge.source()).map(policy::isAgent).orElse(false)
            && graph.step(edge.target()).map(policy::isToolCapable).orElse(false));
        var fixes = new ArrayList<String>();
        for (var edge : backwards) {
            var reversed = Edge.of(edge.target(), edge.source(), PortKind.TOOL);
            if (!graph.containsEdge(reversed)) {
                graph.addEdge(reversed);
            }
            fixes.add("Reversed tool connection " + edge.describe() + " to " + reversed.describe());
        }
        return fixes;
    }
}
