package work.lcod.flowguard.repair;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import work.lcod.flowguard.graph.Edge;
import work.lcod.flowguard.graph.FlowGraph;
import work.lcod.flowguard.graph.PortKind;
import work.lcod.flowguard.graph.Step;
import work.lcod.flowguard.policy.StepRole;

/**
 * Connects steps that have neither inbound nor outbound edges.
 *
 * <p>Agents are valid terminals and stay alone. Tools go to the first agent, models and
 * memories to the first agent still lacking one, triggers to the first main-chain step
 * without a main input. Everything else is appended after the first agent, or the first
 * main-chain step, whose main output is still free. Newly wired auxiliaries are laid out
 * again around their agent.
 */
final class ReconnectOrphansPass implements RepairPass {
    static final String ID = "reconnect-orphans";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<String> apply(RepairContext context) {
        var graph = context.graph();
        var fixes = new ArrayList<String>();
        boolean wiredAuxiliary = false;
        for (var step : List.copyOf(graph.steps())) {
            if (!step.hasName() || !isOrphan(graph, step)) {
                continue;
            }
            var role = context.role(step);
            Optional<Edge> edge = switch (role) {
                case AGENT, DECORATIVE -> Optional.empty();
                case TOOL -> context.firstAgent().map(agent -> Edge.of(step.name(), agent.name(), PortKind.TOOL));
                case LANGUAGE_MODEL -> agentLacking(context, PortKind.LANGUAGE_MODEL)
                    .map(agent -> Edge.of(step.name(), agent.name(), PortKind.LANGUAGE_MODEL));
                case MEMORY -> agentLacking(context, PortKind.MEMORY)
                    .map(agent -> Edge.of(step.name(), agent.name(), PortKind.MEMORY));
                case TRIGGER -> firstEntryless(context, step).map(entry -> Edge.main(step.name(), entry.name()));
                default -> freeUpstream(context, step).map(upstream -> Edge.main(upstream.name(), step.name()));
            };
            if (edge.isEmpty()) {
                continue;
            }
            graph.addEdge(edge.get());
            wiredAuxiliary |= role.isAgentInfrastructure();
            fixes.add("Connected orphan step \"" + step.name() + "\" via " + edge.get().describe());
        }
        if (wiredAuxiliary) {
            fixes.addAll(LayoutAuxiliariesPass.layout(context));
        }
        return fixes;
    }

    private static boolean isOrphan(FlowGraph graph, Step step) {
        return !graph.hasOutbound(step.name()) && !graph.hasInbound(step.name());
    }

    private static Optional<Step> agentLacking(RepairContext context, PortKind portKind) {
        for (var agent : context.stepsWithRole(StepRole.AGENT)) {
            boolean wired = context.graph().incoming(agent.name()).stream()
                .anyMatch(edge -> edge.portKind() == portKind);
            if (!wired) {
                return Optional.of(agent);
            }
        }
        return Optional.empty();
    }

    private static Optional<Step> firstEntryless(RepairContext context, Step trigger) {
        for (var step : context.graph().steps()) {
            if (step == trigger || !step.hasName() || !isMainChain(context, step)) {
                continue;
            }
            boolean fed = context.graph().incoming(step.name()).stream()
                .anyMatch(edge -> edge.portKind() == PortKind.MAIN);
            if (!fed) {
                return Optional.of(step);
            }
        }
        return Optional.empty();
    }

    private static Optional<Step> freeUpstream(RepairContext context, Step orphan) {
        for (var agent : context.stepsWithRole(StepRole.AGENT)) {
            if (hasFreeMainOutput(context.graph(), agent)) {
                return Optional.of(agent);
            }
        }
        for (var step : context.graph().steps()) {
            var role = context.role(step);
            if (step == orphan || !step.hasName() || (role != StepRole.REGULAR && role != StepRole.ROUTER)) {
                continue;
            }
            if (hasFreeMainOutput(context.graph(), step)) {
                return Optional.of(step);
            }
        }
        return Optional.empty();
    }

    private static boolean hasFreeMainOutput(FlowGraph graph, Step step) {
        return graph.slots(step.name(), PortKind.MAIN).isEmpty();
    }

    private static boolean isMainChain(RepairContext context, Step step) {
        var role = context.role(step);
        return role == StepRole.REGULAR || role == StepRole.ROUTER || role == StepRole.AGENT;
    }
}
