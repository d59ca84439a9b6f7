package work.lcod.flowguard.validation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import work.lcod.flowguard.graph.Edge;
import work.lcod.flowguard.graph.FlowGraph;
import work.lcod.flowguard.graph.PortKind;
import work.lcod.flowguard.graph.Step;
import work.lcod.flowguard.policy.PortKindPolicy;
import work.lcod.flowguard.policy.StepNames;

/**
 * Schema and structural checks over a {@link FlowGraph}. Never mutates the graph.
 */
public final class StructuralValidator {
    private final PortKindPolicy policy;

    public StructuralValidator(PortKindPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public ValidationIssues validate(FlowGraph graph) {
        var errors = new ArrayList<String>();
        var warnings = new ArrayList<String>();
        if (graph.steps().isEmpty()) {
            errors.add("Workflow must have at least one step");
            return new ValidationIssues(errors, warnings);
        }

        checkSteps(graph, errors, warnings);
        checkDuplicateNames(graph, errors);
        if (graph.steps().stream().noneMatch(policy::isTrigger)) {
            warnings.add("Workflow has no trigger step - it can only be started manually or as a sub-workflow");
        }
        checkEdges(graph, errors, warnings);
        checkFanout(graph, warnings);
        checkHangingSteps(graph, errors);
        checkAgents(graph, errors, warnings);
        return new ValidationIssues(errors, warnings);
    }

    private void checkSteps(FlowGraph graph, List<String> errors, List<String> warnings) {
        var steps = graph.steps();
        for (int index = 0; index < steps.size(); index++) {
            var step = steps.get(index);
            var label = step.hasName() ? "Step \"" + step.name() + "\"" : "Step at index " + index;
            if (!step.hasName()) {
                errors.add("Step at index " + index + " is missing 'name' field");
            } else if (StepNames.isGeneric(step.name())) {
                warnings.add(label + " has a generic name - use a descriptive name");
            }
            if (step.kind() == null || step.kind().isBlank()) {
                errors.add(label + " is missing 'type' field");
            } else if (!step.kind().contains(".")) {
                warnings.add(label + " has type \"" + step.kind() + "\" without a package prefix");
            }
            if (step.position() == null) {
                errors.add(label + " (index " + index + ") is missing or has a malformed 'position' field");
            }
            if (step.parameters() == null) {
                errors.add(label + " (index " + index + ") is missing 'parameters' object");
            }
        }
    }

    private void checkDuplicateNames(FlowGraph graph, List<String> errors) {
        var counts = new LinkedHashMap<String, Integer>();
        for (var step : graph.steps()) {
            if (step.hasName()) {
                counts.merge(step.name(), 1, Integer::sum);
            }
        }
        for (var entry : counts.entrySet()) {
            if (entry.getValue() > 1) {
                errors.add("Duplicate step name \"" + entry.getKey() + "\" is used by " + entry.getValue() + " steps");
            }
        }
    }

    private void checkEdges(FlowGraph graph, List<String> errors, List<String> warnings) {
        var seen = new LinkedHashMap<Edge, Integer>();
        for (var edge : graph.edges()) {
            seen.merge(edge, 1, Integer::sum);
            var source = graph.step(edge.source());
            var target = graph.step(edge.target());
            if (source.isEmpty() || target.isEmpty()) {
                var missing = new ArrayList<String>();
                if (source.isEmpty()) {
                    missing.add("source \"" + edge.source() + "\"");
                }
                if (target.isEmpty()) {
                    missing.add("target \"" + edge.target() + "\"");
                }
                errors.add("Connection " + edge.describe() + " references unknown " + String.join(" and ", missing));
                continue;
            }
            if (edge.portKind() == PortKind.TOOL) {
                checkToolEdge(edge, source.get(), target.get(), errors, warnings);
                continue;
            }
            if (!policy.allowsOutbound(source.get(), edge.portKind())) {
                warnings.add("Step \"" + edge.source() + "\" (" + policy.role(source.get()) + ") should not emit "
                    + edge.portKind().wireName() + " connections");
            }
            if (!policy.allowsInbound(target.get(), edge.portKind())) {
                warnings.add("Step \"" + edge.target() + "\" (" + policy.role(target.get()) + ") should not receive "
                    + edge.portKind().wireName() + " connections");
            }
        }
        for (var entry : seen.entrySet()) {
            if (entry.getValue() > 1) {
                warnings.add("Duplicate connection detected: " + entry.getKey().describe()
                    + " is declared " + entry.getValue() + " times");
            }
        }
    }

    private void checkToolEdge(Edge edge, Step source, Step target, List<String> errors, List<String> warnings) {
        if (!policy.isToolCapable(source) || !policy.isAgent(target)) {
            errors.add("Tool connection " + edge.describe() + " must run from a tool step to an agent");
        }
        if (edge.targetIndex() != 0) {
            warnings.add("Tool connection " + edge.describe() + " uses index " + edge.targetIndex() + " instead of 0");
        }
    }

    private void checkFanout(FlowGraph graph, List<String> warnings) {
        for (var source : graph.connections().keySet()) {
            var step = graph.step(source);
            if (step.isEmpty() || policy.isRouter(step.get())) {
                continue;
            }
            var slots = graph.slots(source, PortKind.MAIN);
            for (int slot = 0; slot < slots.size(); slot++) {
                if (slots.get(slot).size() > 1) {
                    warnings.add("Step \"" + source + "\" fans out to " + slots.get(slot).size()
                        + " steps from output " + slot + " - only routing steps may branch");
                }
            }
        }
    }

    private void checkHangingSteps(FlowGraph graph, List<String> errors) {
        var connected = new HashSet<String>();
        for (var edge : graph.edges()) {
            connected.add(edge.source());
            connected.add(edge.target());
        }
        for (var step : graph.steps()) {
            if (!step.hasName() || connected.contains(step.name())) {
                continue;
            }
            var role = policy.role(step);
            switch (role) {
                case AGENT, DECORATIVE -> {
                }
                case TRIGGER -> errors.add("Hanging trigger: \"" + step.name()
                    + "\" is not connected - workflow cannot start. Connect it to the first action step");
                case TOOL -> errors.add(hangingAuxiliary("tool", step, PortKind.TOOL));
                case LANGUAGE_MODEL -> errors.add(hangingAuxiliary("language model", step, PortKind.LANGUAGE_MODEL));
                case MEMORY -> errors.add(hangingAuxiliary("memory", step, PortKind.MEMORY));
                default -> errors.add("Hanging step: \"" + step.name()
                    + "\" is not connected to workflow. Every step needs at least one connection");
            }
        }
    }

    private static String hangingAuxiliary(String what, Step step, PortKind portKind) {
        return "Hanging " + what + ": \"" + step.name() + "\" is not connected via "
            + portKind.wireName() + " to any agent";
    }

    private void checkAgents(FlowGraph graph, List<String> errors, List<String> warnings) {
        Set<String> checked = new LinkedHashSet<>();
        for (var agent : graph.steps()) {
            if (!agent.hasName() || !policy.isAgent(agent) || !checked.add(agent.name())) {
                continue;
            }
            Map<PortKind, List<Edge>> inbound = new LinkedHashMap<>();
            for (var edge : graph.incoming(agent.name())) {
                inbound.computeIfAbsent(edge.portKind(), key -> new ArrayList<>()).add(edge);
            }
            checkAgentInput(graph, agent, inbound.getOrDefault(PortKind.LANGUAGE_MODEL, List.of()),
                policy::isLanguageModel, "language model", errors);
            checkAgentInput(graph, agent, inbound.getOrDefault(PortKind.MEMORY, List.of()),
                policy::isMemory, "memory", errors);
            if (inbound.getOrDefault(PortKind.TOOL, List.of()).isEmpty()) {
                warnings.add("Agent \"" + agent.name() + "\" has no tools connected - agent may have limited capabilities");
            }
        }
    }

    private void checkAgentInput(
        FlowGraph graph,
        Step agent,
        List<Edge> edges,
        Predicate<Step> expected,
        String what,
        List<String> errors
    ) {
        if (edges.isEmpty()) {
            errors.add("Agent \"" + agent.name() + "\" is missing its " + what + " connection");
            return;
        }
        if (edges.size() > 1) {
            errors.add("Agent \"" + agent.name() + "\" has " + edges.size() + " " + what
                + " connections - exactly one is required");
        }
        for (var edge : edges) {
            var source = graph.step(edge.source());
            if (source.isPresent() && !expected.test(source.get())) {
                errors.add("Agent \"" + agent.name() + "\" has invalid " + what + " type \""
                    + source.get().kindOrEmpty() + "\" connected from \"" + edge.source() + "\"");
            }
        }
    }
}
