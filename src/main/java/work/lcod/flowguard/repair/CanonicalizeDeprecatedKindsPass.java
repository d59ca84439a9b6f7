package work.lcod.flowguard.repair;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import work.lcod.flowguard.policy.StepNames;

/**
 * Replaces deprecated kinds with their successor and renames the step after the new kind.
 */
final class CanonicalizeDeprecatedKindsPass implements RepairPass {
    static final String ID = "canonicalize-deprecated-kinds";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<String> apply(RepairContext context) {
        var graph = context.graph();
        var fixes = new ArrayList<String>();
        for (var step : graph.steps()) {
            var canonical = context.policy().canonicalKind(step.kind());
            if (canonical.isEmpty()) {
                continue;
            }
            var oldKind = step.kind();
            var oldName = step.name();
            step.setKind(canonical.get());

            var used = new HashSet<String>();
            for (var other : graph.steps()) {
                if (other != step && other.name() != null) {
                    used.add(other.name());
                }
            }
            var newName = StepNames.uniquify(context.names().descriptiveName(canonical.get()), used);
            // edges addressed by a duplicated name belong to its first holder
            boolean ownsEdges = oldName != null && graph.step(oldName).map(first -> first == step).orElse(false);
            graph.renameStep(step, newName, ownsEdges);

            var message = "Replaced deprecated type \"" + oldKind + "\" with \"" + canonical.get() + "\"";
            if (!newName.equals(oldName)) {
                message += " and renamed " + (oldName == null ? "unnamed step" : "\"" + oldName + "\"")
                    + " to \"" + newName + "\"";
            }
            fixes.add(message);
        }
        return fixes;
    }
}
