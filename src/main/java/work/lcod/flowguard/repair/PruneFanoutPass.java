package work.lcod.flowguard.repair;

import java.util.ArrayList;
import java.util.List;
import work.lcod.flowguard.graph.PortKind;

/**
 * Keeps only the first-declared {@code main} edge per output slot of non-router steps.
 */
final class PruneFanoutPass implements RepairPass {
    static final String ID = "prune-fanout";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<String> apply(RepairContext context) {
        var graph = context.graph();
        var fixes = new ArrayList<String>();
        for (var source : List.copyOf(graph.connections().keySet())) {
            var step = graph.step(source);
            if (step.isEmpty() || context.policy().isRouter(step.get())) {
                continue;
            }
            int slotCount = graph.slots(source, PortKind.MAIN).size();
            for (int slot = 0; slot < slotCount; slot++) {
                for (var dropped : graph.truncateSlot(source, PortKind.MAIN, slot, 1)) {
                    fixes.add("Removed extra connection " + dropped.describe() + " from non-routing step \""
                        + source + "\" (output " + slot + ")");
                }
            }
        }
        return fixes;
    }
}
