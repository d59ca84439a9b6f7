package work.lcod.flowguard.graph;

import java.util.Locale;
import java.util.Optional;

/**
 * Connection slot categories. {@link #MAIN} carries ordinary data flow, the others wire
 * agent infrastructure.
 */
public enum PortKind {
    MAIN("main", "main"),
    TOOL("ai_tool", "tool"),
    LANGUAGE_MODEL("ai_languageModel", "languageModel"),
    MEMORY("ai_memory", "memory");

    private final String wireName;
    private final String shortName;

    PortKind(String wireName, String shortName) {
        this.wireName = wireName;
        this.shortName = shortName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isAgentInfrastructure() {
        return this != MAIN;
    }

    public static Optional<PortKind> fromWire(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (PortKind kind : values()) {
            if (kind.wireName.equals(trimmed) || kind.shortName.equals(trimmed)) {
                return Optional.of(kind);
            }
        }
        String lowered = trimmed.toLowerCase(Locale.ROOT);
        for (PortKind kind : values()) {
            if (kind.wireName.toLowerCase(Locale.ROOT).equals(lowered)
                || kind.shortName.toLowerCase(Locale.ROOT).equals(lowered)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
