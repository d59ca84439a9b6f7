package work.lcod.flowguard.graph;

/**
 * Canvas coordinates of a step. Layout only, no semantic effect.
 */
public record Position(double x, double y) {
    public Position offset(double dx, double dy) {
        return new Position(x + dx, y + dy);
    }
}
