package work.lcod.flowguard.repair;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import work.lcod.flowguard.graph.Position;

/**
 * Fills in missing positions ({@code (100 + 200 i, 250)}) and parameter maps.
 */
final class CompleteSchemaPass implements RepairPass {
    static final String ID = "complete-schema";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<String> apply(RepairContext context) {
        var fixes = new ArrayList<String>();
        var steps = context.graph().steps();
        for (int index = 0; index < steps.size(); index++) {
            var step = steps.get(index);
            if (step.position() == null) {
                step.setPosition(defaultPosition(index));
                fixes.add("Set default position for step " + context.label(step));
            }
            if (step.parameters() == null) {
                step.setParameters(new LinkedHashMap<>());
                fixes.add("Added empty parameters object for step " + context.label(step));
            }
        }
        return fixes;
    }

    static Position defaultPosition(int index) {
        return new Position(100 + 200 * index, 250);
    }
}
