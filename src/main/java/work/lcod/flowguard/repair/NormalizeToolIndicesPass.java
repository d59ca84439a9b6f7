package work.lcod.flowguard.repair;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import work.lcod.flowguard.graph.Edge;
import work.lcod.flowguard.graph.PortKind;

/**
 * Tool ports have a single slot, so every tool edge targets index 0. An edge whose reset form
 * already exists is removed instead.
 */
final class NormalizeToolIndicesPass implements RepairPass {
    static final String ID = "normalize-tool-indices";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<String> apply(RepairContext context) {
        var graph = context.graph();
        var present = new HashSet<>(graph.edges());
        var redundant = new HashSet<Edge>();
        for (var edge : graph.edges()) {
            if (misindexed(edge) && !present.add(edge.withTargetIndex(0))) {
                redundant.add(edge);
            }
        }
        var fixes = new ArrayList<String>();
        for (var edge : graph.removeEdges(redundant::contains)) {
            fixes.add("Removed tool connection " + edge.describe() + " duplicating its index 0 form");
        }
        graph.replaceEdges(edge -> {
            if (!misindexed(edge)) {
                return edge;
            }
            fixes.add("Reset tool connection index " + edge.targetIndex() + " to 0 on " + edge.describe());
            return edge.withTargetIndex(0);
        });
        return fixes;
    }

    private static boolean misindexed(Edge edge) {
        return edge.portKind() == PortKind.TOOL && edge.targetIndex() != 0;
    }
}
