package work.lcod.flowguard.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Ordered steps plus name-addressed adjacency ({@code source -> port kind -> slot -> edges}).
 *
 * <p>Instances are mutable so the repair pipeline can rewrite its private copy in place;
 * callers hand over a graph and get a {@link #deepCopy()} back, never their own instance.
 */
public final class FlowGraph {
    private String name;
    private final List<Step> steps = new ArrayList<>();
    private final Map<String, Map<PortKind, List<List<Edge>>>> connections = new LinkedHashMap<>();
    private Boolean active;
    private Map<String, Object> settings;
    private final Map<String, Object> extras = new LinkedHashMap<>();

    public FlowGraph() {
        this(null);
    }

    public FlowGraph(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Boolean active() {
        return active;
    }

    public void setActive(Boolean active) {
        this.active = active;
    }

    public Map<String, Object> settings() {
        return settings;
    }

    public void setSettings(Map<String, Object> settings) {
        this.settings = settings;
    }

    public Map<String, Object> extras() {
        return extras;
    }

    public List<Step> steps() {
        return Collections.unmodifiableList(steps);
    }

    public FlowGraph addStep(Step step) {
        steps.add(Objects.requireNonNull(step, "step"));
        return this;
    }

    /**
     * First step holding {@code stepName}. Blank names address no step.
     */
    public Optional<Step> step(String stepName) {
        if (stepName == null || stepName.isBlank()) {
            return Optional.empty();
        }
        for (var step : steps) {
            if (stepName.equals(step.name())) {
                return Optional.of(step);
            }
        }
        return Optional.empty();
    }

    public Set<String> stepNames() {
        var names = new LinkedHashSet<String>();
        for (var step : steps) {
            if (step.hasName()) {
                names.add(step.name());
            }
        }
        return names;
    }

    public Map<String, Map<PortKind, List<List<Edge>>>> connections() {
        return Collections.unmodifiableMap(connections);
    }

    /**
     * All edges in declaration order (source key, port kind, slot, position in slot).
     */
    public List<Edge> edges() {
        var all = new ArrayList<Edge>();
        for (var ports : connections.values()) {
            for (var slots : ports.values()) {
                for (var slot : slots) {
                    all.addAll(slot);
                }
            }
        }
        return all;
    }

    public int edgeCount() {
        int count = 0;
        for (var ports : connections.values()) {
            for (var slots : ports.values()) {
                for (var slot : slots) {
                    count += slot.size();
                }
            }
        }
        return count;
    }

    public List<Edge> outgoing(String stepName) {
        var ports = connections.get(stepName);
        if (ports == null) {
            return List.of();
        }
        var out = new ArrayList<Edge>();
        for (var slots : ports.values()) {
            for (var slot : slots) {
                out.addAll(slot);
            }
        }
        return out;
    }

    public List<Edge> incoming(String stepName) {
        var in = new ArrayList<Edge>();
        for (var edge : edges()) {
            if (edge.target().equals(stepName)) {
                in.add(edge);
            }
        }
        return in;
    }

    public boolean hasOutbound(String stepName) {
        return !outgoing(stepName).isEmpty();
    }

    public boolean hasInbound(String stepName) {
        for (var edge : edges()) {
            if (edge.target().equals(stepName)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Output slots of one port kind for a source step; empty when the step emits none.
     */
    public List<List<Edge>> slots(String source, PortKind portKind) {
        var ports = connections.get(source);
        if (ports == null || !ports.containsKey(portKind)) {
            return List.of();
        }
        var view = new ArrayList<List<Edge>>();
        for (var slot : ports.get(portKind)) {
            view.add(Collections.unmodifiableList(slot));
        }
        return Collections.unmodifiableList(view);
    }

    public boolean containsEdge(Edge edge) {
        for (var slot : slots(edge.source(), edge.portKind())) {
            if (slot.contains(edge)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Appends an edge to its source slot, creating intermediate empty slots as needed.
     */
    public FlowGraph addEdge(Edge edge) {
        Objects.requireNonNull(edge, "edge");
        var slots = connections
            .computeIfAbsent(edge.source(), key -> new LinkedHashMap<>())
            .computeIfAbsent(edge.portKind(), key -> new ArrayList<>());
        while (slots.size() <= edge.sourceIndex()) {
            slots.add(new ArrayList<>());
        }
        slots.get(edge.sourceIndex()).add(edge);
        return this;
    }

    /**
     * Removes every edge matching the predicate and prunes emptied containers.
     *
     * @return removed edges in declaration order
     */
    public List<Edge> removeEdges(Predicate<Edge> predicate) {
        var removed = new ArrayList<Edge>();
        for (var ports : connections.values()) {
            for (var slots : ports.values()) {
                for (var slot : slots) {
                    var iterator = slot.iterator();
                    while (iterator.hasNext()) {
                        var edge = iterator.next();
                        if (predicate.test(edge)) {
                            removed.add(edge);
                            iterator.remove();
                        }
                    }
                }
            }
        }
        if (!removed.isEmpty()) {
            prune();
        }
        return removed;
    }

    /**
     * Keeps the first {@code keep} edges of one slot and drops the rest.
     *
     * @return dropped edges in declaration order
     */
    public List<Edge> truncateSlot(String source, PortKind portKind, int slotIndex, int keep) {
        var ports = connections.get(source);
        if (ports == null || !ports.containsKey(portKind)) {
            return List.of();
        }
        var slots = ports.get(portKind);
        if (slotIndex >= slots.size()) {
            return List.of();
        }
        var slot = slots.get(slotIndex);
        if (slot.size() <= keep) {
            return List.of();
        }
        var dropped = new ArrayList<>(slot.subList(keep, slot.size()));
        slot.subList(keep, slot.size()).clear();
        prune();
        return dropped;
    }

    /**
     * Replaces edges in place. The mapper must keep the edge's source, port kind and slot.
     *
     * @return number of edges the mapper changed
     */
    public int replaceEdges(UnaryOperator<Edge> mapper) {
        int changed = 0;
        for (var ports : connections.values()) {
            for (var slots : ports.values()) {
                for (var slot : slots) {
                    for (int i = 0; i < slot.size(); i++) {
                        var current = slot.get(i);
                        var replacement = mapper.apply(current);
                        if (replacement == null || replacement.equals(current)) {
                            continue;
                        }
                        if (!replacement.source().equals(current.source())
                            || replacement.portKind() != current.portKind()
                            || replacement.sourceIndex() != current.sourceIndex()) {
                            throw new IllegalArgumentException("Edge replacement must keep source, port kind and slot: " + current);
                        }
                        slot.set(i, replacement);
                        changed++;
                    }
                }
            }
        }
        return changed;
    }

    /**
     * Renames a step. When {@code rewriteReferences} is set, every edge naming the old name
     * as source key or target is rewritten in one swap of the adjacency structure, so no
     * partially renamed state is ever observable.
     */
    public void renameStep(Step step, String newName, boolean rewriteReferences) {
        Objects.requireNonNull(step, "step");
        Objects.requireNonNull(newName, "newName");
        if (!steps.contains(step)) {
            throw new IllegalArgumentException("Step does not belong to this graph: " + step);
        }
        var oldName = step.name();
        if (newName.equals(oldName)) {
            return;
        }
        if (rewriteReferences && oldName != null) {
            var rewritten = new LinkedHashMap<String, Map<PortKind, List<List<Edge>>>>();
            for (var entry : connections.entrySet()) {
                var sourceKey = entry.getKey().equals(oldName) ? newName : entry.getKey();
                var ports = rewritten.computeIfAbsent(sourceKey, key -> new LinkedHashMap<>());
                for (var portEntry : entry.getValue().entrySet()) {
                    var slots = ports.computeIfAbsent(portEntry.getKey(), key -> new ArrayList<>());
                    var incoming = portEntry.getValue();
                    while (slots.size() < incoming.size()) {
                        slots.add(new ArrayList<>());
                    }
                    for (int i = 0; i < incoming.size(); i++) {
                        for (var edge : incoming.get(i)) {
                            var moved = edge.source().equals(oldName) ? edge.withSource(newName) : edge;
                            if (moved.target().equals(oldName)) {
                                moved = moved.withTarget(newName);
                            }
                            slots.get(i).add(moved);
                        }
                    }
                }
            }
            connections.clear();
            connections.putAll(rewritten);
        }
        step.setName(newName);
    }

    public FlowGraph deepCopy() {
        var copy = new FlowGraph(name);
        for (var step : steps) {
            copy.steps.add(step.deepCopy());
        }
        for (var entry : connections.entrySet()) {
            var ports = new LinkedHashMap<PortKind, List<List<Edge>>>();
            for (var portEntry : entry.getValue().entrySet()) {
                var slots = new ArrayList<List<Edge>>();
                for (var slot : portEntry.getValue()) {
                    slots.add(new ArrayList<>(slot));
                }
                ports.put(portEntry.getKey(), slots);
            }
            copy.connections.put(entry.getKey(), ports);
        }
        copy.active = active;
        copy.settings = JsonValues.copyMap(settings);
        copy.extras.putAll(JsonValues.copyMap(extras));
        return copy;
    }

    private void prune() {
        var sourceIterator = connections.entrySet().iterator();
        while (sourceIterator.hasNext()) {
            var ports = sourceIterator.next().getValue();
            var portIterator = ports.entrySet().iterator();
            while (portIterator.hasNext()) {
                var slots = portIterator.next().getValue();
                while (!slots.isEmpty() && slots.get(slots.size() - 1).isEmpty()) {
                    slots.remove(slots.size() - 1);
                }
                if (slots.isEmpty()) {
                    portIterator.remove();
                }
            }
            if (ports.isEmpty()) {
                sourceIterator.remove();
            }
        }
    }
}
