package work.lcod.flowguard.repair;

import java.util.List;
import java.util.Objects;
import work.lcod.flowguard.graph.FlowGraph;

/**
 * Repaired copy of a graph together with the changes applied to it.
 */
public record RepairResult(FlowGraph graph, boolean changed, List<String> fixes) {
    public RepairResult {
        Objects.requireNonNull(graph, "graph");
        fixes = List.copyOf(fixes);
    }
}
