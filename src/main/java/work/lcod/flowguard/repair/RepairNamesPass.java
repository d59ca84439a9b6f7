package work.lcod.flowguard.repair;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import work.lcod.flowguard.policy.StepNames;

/**
 * Gives missing, generic ({@code Node1}) and colliding names a descriptive, unique name.
 *
 * <p>Valid names keep priority: every first occurrence of a non-generic name is reserved
 * before anything is renamed. Of several steps sharing a name the first keeps it, and edges
 * addressed by a name always follow its first holder.
 */
final class RepairNamesPass implements RepairPass {
    static final String ID = "repair-names";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<String> apply(RepairContext context) {
        var graph = context.graph();
        var used = new HashSet<String>();
        for (var step : graph.steps()) {
            if (step.hasName() && !StepNames.isGeneric(step.name())) {
                used.add(step.name());
            }
        }
        var encountered = new HashSet<String>();
        var fixes = new ArrayList<String>();
        for (var step : List.copyOf(graph.steps())) {
            var oldName = step.name();
            boolean named = step.hasName();
            boolean firstHolder = named && encountered.add(oldName);
            boolean generic = named && StepNames.isGeneric(oldName);
            if (firstHolder && !generic) {
                continue;
            }
            var newName = StepNames.uniquify(context.names().descriptiveName(step.kind()), used);
            used.add(newName);
            graph.renameStep(step, newName, firstHolder);
            if (!named) {
                fixes.add("Added descriptive name \"" + newName + "\"");
            } else if (generic) {
                fixes.add("Renamed generic \"" + oldName + "\" to \"" + newName + "\"");
            } else {
                fixes.add("Resolved duplicate name \"" + oldName + "\" to \"" + newName + "\"");
            }
        }
        return fixes;
    }
}
