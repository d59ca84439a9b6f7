package work.lcod.flowguard.graph;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One processing unit of a flow graph.
 *
 * <p>{@code name}, {@code kind}, {@code position} and {@code parameters} may be {@code null}
 * on steps read from untrusted documents; the validator reports them and the repair passes
 * fill them in. Mutators are used by the repair pipeline on its private copy only.
 */
public final class Step {
    private String id;
    private String name;
    private String kind;
    private Number kindVersion;
    private Position position;
    private Map<String, Object> parameters;
    private Map<String, Object> credentials;
    private final Map<String, Object> extras;

    public Step(String name, String kind, Position position, Map<String, Object> parameters) {
        this(null, name, kind, null, position, parameters, null, null);
    }

    public Step(
        String id,
        String name,
        String kind,
        Number kindVersion,
        Position position,
        Map<String, Object> parameters,
        Map<String, Object> credentials,
        Map<String, Object> extras
    ) {
        this.id = id;
        this.name = name;
        this.kind = kind;
        this.kindVersion = kindVersion;
        this.position = position;
        this.parameters = parameters == null ? null : new LinkedHashMap<>(parameters);
        this.credentials = credentials == null ? null : new LinkedHashMap<>(credentials);
        this.extras = extras == null ? new LinkedHashMap<>() : new LinkedHashMap<>(extras);
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String kind() {
        return kind;
    }

    /**
     * Kind string or the empty string, for classification code that never wants null.
     */
    public String kindOrEmpty() {
        return kind == null ? "" : kind;
    }

    public Number kindVersion() {
        return kindVersion;
    }

    public Position position() {
        return position;
    }

    public Map<String, Object> parameters() {
        return parameters;
    }

    public Map<String, Object> credentials() {
        return credentials;
    }

    public Map<String, Object> extras() {
        return extras;
    }

    public boolean hasName() {
        return name != null && !name.isBlank();
    }

    void setName(String name) {
        this.name = name;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public void setPosition(Position position) {
        this.position = position;
    }

    public void setParameters(Map<String, Object> parameters) {
        this.parameters = parameters;
    }

    public void setCredentials(Map<String, Object> credentials) {
        this.credentials = credentials;
    }

    public Step deepCopy() {
        return new Step(
            id,
            name,
            kind,
            kindVersion,
            position,
            JsonValues.copyMap(parameters),
            JsonValues.copyMap(credentials),
            JsonValues.copyMap(extras)
        );
    }

    @Override
    public String toString() {
        return "Step[" + name + " (" + kind + ")]";
    }
}
