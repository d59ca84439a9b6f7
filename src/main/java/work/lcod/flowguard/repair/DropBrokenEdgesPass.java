package work.lcod.flowguard.repair;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import work.lcod.flowguard.graph.Edge;

/**
 * Removes edges naming unknown steps and exact duplicates (the first declaration is kept).
 */
final class DropBrokenEdgesPass implements RepairPass {
    static final String ID = "drop-broken-edges";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<String> apply(RepairContext context) {
        var graph = context.graph();
        var known = graph.stepNames();
        var fixes = new ArrayList<String>();
        for (var edge : graph.removeEdges(edge -> !known.contains(edge.source()) || !known.contains(edge.target()))) {
            var missing = known.contains(edge.source()) ? edge.target() : edge.source();
            fixes.add("Removed connection " + edge.describe() + " to non-existent step \"" + missing + "\"");
        }
        var seen = new HashSet<Edge>();
        for (var edge : graph.removeEdges(edge -> !seen.add(edge))) {
            fixes.add("Removed duplicate connection " + edge.describe());
        }
        return fixes;
    }
}
