package work.lcod.flowguard.analysis;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import work.lcod.flowguard.graph.FlowGraph;
import work.lcod.flowguard.graph.PortKind;
import work.lcod.flowguard.graph.Step;
import work.lcod.flowguard.policy.PortKindPolicy;

/**
 * Depth, fan-out and orphan detection over a {@link FlowGraph}.
 */
public final class ConnectivityAnalyzer {
    private final PortKindPolicy policy;

    public ConnectivityAnalyzer(PortKindPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * Longest {@code main} path, in edges, from the first trigger step. Depths only ever
     * increase and are capped at {@code steps - 1}, so cycles cannot keep the work-list alive.
     */
    public int depth(FlowGraph graph) {
        var trigger = graph.steps().stream()
            .filter(step -> step.hasName() && policy.isTrigger(step))
            .findFirst();
        if (trigger.isEmpty()) {
            return 0;
        }
        var known = graph.stepNames();
        int cap = Math.max(0, graph.steps().size() - 1);
        var depths = new HashMap<String, Integer>();
        var queue = new ArrayDeque<String>();
        var root = trigger.get().name();
        depths.put(root, 0);
        queue.add(root);
        int deepest = 0;
        while (!queue.isEmpty()) {
            var current = queue.poll();
            int next = depths.get(current) + 1;
            if (next > cap) {
                continue;
            }
            for (var slot : graph.slots(current, PortKind.MAIN)) {
                for (var edge : slot) {
                    if (!known.contains(edge.target())) {
                        continue;
                    }
                    var previous = depths.get(edge.target());
                    if (previous == null || previous < next) {
                        depths.put(edge.target(), next);
                        deepest = Math.max(deepest, next);
                        queue.add(edge.target());
                    }
                }
            }
        }
        return deepest;
    }

    /**
     * Largest number of {@code main} edges leaving one (step, output slot) pair.
     */
    public int maxFanout(FlowGraph graph) {
        int max = 0;
        for (var source : graph.connections().keySet()) {
            for (var slot : graph.slots(source, PortKind.MAIN)) {
                max = Math.max(max, slot.size());
            }
        }
        return max;
    }

    /**
     * Steps with neither inbound nor outbound edges, in declaration order.
     */
    public List<Step> orphans(FlowGraph graph) {
        var connected = new HashSet<String>();
        for (var edge : graph.edges()) {
            connected.add(edge.source());
            connected.add(edge.target());
        }
        var orphans = new ArrayList<Step>();
        for (var step : graph.steps()) {
            if (!step.hasName() || !connected.contains(step.name())) {
                orphans.add(step);
            }
        }
        return orphans;
    }

    public ConnectivitySummary summary(FlowGraph graph) {
        var orphanNames = new ArrayList<String>();
        for (var step : orphans(graph)) {
            orphanNames.add(step.name() == null ? "<unnamed>" : step.name());
        }
        return new ConnectivitySummary(
            graph.steps().size(),
            graph.edgeCount(),
            depth(graph),
            maxFanout(graph),
            orphanNames
        );
    }
}
