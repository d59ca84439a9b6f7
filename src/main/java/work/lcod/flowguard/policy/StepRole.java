package work.lcod.flowguard.policy;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import work.lcod.flowguard.graph.PortKind;

/**
 * Structural role of a step kind and the port kinds that role may accept and emit.
 */
public enum StepRole {
    TRIGGER(EnumSet.noneOf(PortKind.class), EnumSet.of(PortKind.MAIN)),
    AGENT(EnumSet.allOf(PortKind.class), EnumSet.of(PortKind.MAIN)),
    LANGUAGE_MODEL(EnumSet.noneOf(PortKind.class), EnumSet.of(PortKind.LANGUAGE_MODEL)),
    MEMORY(EnumSet.noneOf(PortKind.class), EnumSet.of(PortKind.MEMORY)),
    TOOL(EnumSet.noneOf(PortKind.class), EnumSet.of(PortKind.TOOL)),
    ROUTER(EnumSet.of(PortKind.MAIN), EnumSet.of(PortKind.MAIN)),
    REGULAR(EnumSet.of(PortKind.MAIN), EnumSet.of(PortKind.MAIN)),
    DECORATIVE(EnumSet.noneOf(PortKind.class), EnumSet.noneOf(PortKind.class));

    private final Set<PortKind> inbound;
    private final Set<PortKind> outbound;

    StepRole(Set<PortKind> inbound, Set<PortKind> outbound) {
        this.inbound = Set.copyOf(inbound);
        this.outbound = Set.copyOf(outbound);
    }

    public Set<PortKind> inbound() {
        return inbound;
    }

    public Set<PortKind> outbound() {
        return outbound;
    }

    public boolean accepts(PortKind portKind) {
        return inbound.contains(portKind);
    }

    public boolean emits(PortKind portKind) {
        return outbound.contains(portKind);
    }

    /**
     * Model, memory and tool steps only ever feed an agent.
     */
    public boolean isAgentInfrastructure() {
        return this == LANGUAGE_MODEL || this == MEMORY || this == TOOL;
    }

    /**
     * Parses catalog role names such as {@code languageModel}, {@code language_model} or
     * {@code TOOL}.
     */
    public static Optional<StepRole> fromName(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        var normalized = value.trim().replace("-", "").replace("_", "").toUpperCase(Locale.ROOT);
        for (var role : values()) {
            if (role.name().replace("_", "").equals(normalized)) {
                return Optional.of(role);
            }
        }
        if (normalized.equals("MODEL") || normalized.equals("LLM")) {
            return Optional.of(LANGUAGE_MODEL);
        }
        return Optional.empty();
    }
}
