package work.lcod.flowguard.graph;

import java.util.Objects;

/**
 * Directed connection between two steps, addressed by step name.
 */
public record Edge(String source, PortKind portKind, int sourceIndex, String target, int targetIndex) {
    public Edge {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(portKind, "portKind");
        Objects.requireNonNull(target, "target");
        if (sourceIndex < 0) {
            throw new IllegalArgumentException("sourceIndex must not be negative: " + sourceIndex);
        }
        if (targetIndex < 0) {
            throw new IllegalArgumentException("targetIndex must not be negative: " + targetIndex);
        }
    }

    public static Edge main(String source, String target) {
        return new Edge(source, PortKind.MAIN, 0, target, 0);
    }

    public static Edge of(String source, String target, PortKind portKind) {
        return new Edge(source, portKind, 0, target, 0);
    }

    public Edge withSource(String newSource) {
        return new Edge(newSource, portKind, sourceIndex, target, targetIndex);
    }

    public Edge withTarget(String newTarget) {
        return new Edge(source, portKind, sourceIndex, newTarget, targetIndex);
    }

    public Edge withTargetIndex(int newTargetIndex) {
        return new Edge(source, portKind, sourceIndex, target, newTargetIndex);
    }

    public String describe() {
        return "\"" + source + "\" -[" + portKind.wireName() + "]-> \"" + target + "\"";
    }
}
