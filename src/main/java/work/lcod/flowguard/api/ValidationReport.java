package work.lcod.flowguard.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.flowguard.graph.FlowDocumentWriter;
import work.lcod.flowguard.graph.FlowGraph;

/**
 * Outcome of one {@link FlowValidator} call.
 *
 * @param valid no errors remain (after repair when it ran)
 * @param errors residual errors
 * @param warnings advisory findings of the initial and final checks
 * @param fixes changes applied by the repair pipeline, in order
 * @param autofixed whether repair changed anything
 * @param normalized repaired graph when {@code autofixed}, otherwise a copy of the input;
 *     absent when the input could not be read
 */
public record ValidationReport(
    boolean valid,
    List<String> errors,
    List<String> warnings,
    List<String> fixes,
    boolean autofixed,
    Optional<FlowGraph> normalized
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public ValidationReport {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        fixes = List.copyOf(fixes);
        Objects.requireNonNull(normalized, "normalized");
    }

    /**
     * Report for input that is not a workflow document at all: one error, nothing repaired.
     */
    public static ValidationReport fatal(String message) {
        return new ValidationReport(false, List.of(message), List.of(), List.of(), false, Optional.empty());
    }

    public int exitCode() {
        return valid ? 0 : 1;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("valid", valid);
        serializable.put("errors", errors);
        serializable.put("warnings", warnings);
        serializable.put("fixes", fixes);
        serializable.put("autofixed", autofixed);
        normalized.ifPresent(graph -> serializable.put("normalized", FlowDocumentWriter.toNode(graph)));
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"valid\":false,\"errors\":[\"Unable to serialize report: " + ex.getMessage() + "\"]}";
        }
    }
}
