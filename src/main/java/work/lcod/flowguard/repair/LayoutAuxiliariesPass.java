package work.lcod.flowguard.repair;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import work.lcod.flowguard.graph.PortKind;
import work.lcod.flowguard.graph.Position;
import work.lcod.flowguard.graph.Step;
import work.lcod.flowguard.policy.StepRole;

/**
 * Places models, memories and tools around the agent they feed: models below-left, memories
 * below-right, tools in a centred row underneath. An auxiliary feeding several agents follows
 * the first one.
 */
final class LayoutAuxiliariesPass implements RepairPass {
    static final String ID = "layout-agent-auxiliaries";

    static final double SIDE_OFFSET = 200;
    static final double ROW_OFFSET = 300;
    static final double STACK_SPACING = 150;
    static final double TOOL_SPACING = 200;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<String> apply(RepairContext context) {
        return layout(context);
    }

    static List<String> layout(RepairContext context) {
        var fixes = new ArrayList<String>();
        var claimed = new HashSet<Step>();
        for (var agent : context.stepsWithRole(StepRole.AGENT)) {
            var models = feeders(context, agent, PortKind.LANGUAGE_MODEL, StepRole.LANGUAGE_MODEL, claimed);
            var memories = feeders(context, agent, PortKind.MEMORY, StepRole.MEMORY, claimed);
            var tools = feeders(context, agent, PortKind.TOOL, StepRole.TOOL, claimed);
            var origin = agent.position();
            if (origin == null) {
                continue;
            }
            for (int i = 0; i < models.size(); i++) {
                move(context, models.get(i), origin.offset(-SIDE_OFFSET, ROW_OFFSET + STACK_SPACING * i), agent, fixes);
            }
            for (int i = 0; i < memories.size(); i++) {
                move(context, memories.get(i), origin.offset(SIDE_OFFSET, ROW_OFFSET + STACK_SPACING * i), agent, fixes);
            }
            int centre = tools.size() / 2;
            for (int i = 0; i < tools.size(); i++) {
                move(context, tools.get(i), origin.offset((i - centre) * TOOL_SPACING, ROW_OFFSET), agent, fixes);
            }
        }
        return fixes;
    }

    private static List<Step> feeders(RepairContext context, Step agent, PortKind portKind, StepRole role, Set<Step> claimed) {
        var graph = context.graph();
        var found = new LinkedHashSet<Step>();
        for (var edge : graph.incoming(agent.name())) {
            if (edge.portKind() != portKind) {
                continue;
            }
            graph.step(edge.source())
                .filter(source -> context.role(source) == role)
                .filter(source -> !claimed.contains(source))
                .ifPresent(found::add);
        }
        claimed.addAll(found);
        return new ArrayList<>(found);
    }

    private static void move(RepairContext context, Step step, Position target, Step agent, List<String> fixes) {
        if (target.equals(step.position())) {
            return;
        }
        step.setPosition(target);
        fixes.add("Positioned " + context.label(step) + " relative to agent \"" + agent.name() + "\"");
    }
}
