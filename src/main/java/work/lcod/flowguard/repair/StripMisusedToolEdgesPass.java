package work.lcod.flowguard.repair;

import java.util.ArrayList;
import java.util.List;
import work.lcod.flowguard.graph.Edge;
import work.lcod.flowguard.graph.PortKind;

/**
 * Removes tool edges emitted by steps that are not tool-capable. Agent to tool edges are
 * kept for {@link ReverseToolEdgesPass}.
 */
final class StripMisusedToolEdgesPass implements RepairPass {
    static final String ID = "strip-misused-tool-edges";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<String> apply(RepairContext context) {
        var fixes = new ArrayList<String>();
        for (var edge : context.graph().removeEdges(edge -> isMisused(context, edge))) {
            fixes.add("Removed tool connection " + edge.describe() + " from non-tool step \"" + edge.source() + "\"");
        }
        return fixes;
    }

    private static boolean isMisused(RepairContext context, Edge edge) {
        if (edge.portKind() != PortKind.TOOL) {
            return false;
        }
        var graph = context.graph();
        var source = graph.step(edge.source());
        if (source.isEmpty() || context.policy().isToolCapable(source.get())) {
            return false;
        }
        if (context.policy().isAgent(source.get())) {
            var target = graph.step(edge.target());
            return target.isEmpty() || !context.policy().isToolCapable(target.get());
        }
        return true;
    }
}
