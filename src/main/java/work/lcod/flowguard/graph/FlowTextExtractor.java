package work.lcod.flowguard.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Finds a workflow document embedded in free text, such as a generated answer.
 *
 * <p>Fenced {@code WORKFLOW_JSON} blocks are preferred over fenced {@code json} blocks, and
 * among blocks of the same kind the one mentioning {@code "nodes"} and {@code "connections"}
 * wins, longer text breaking ties. Without any fenced block the outermost brace-delimited
 * object is used when it mentions {@code "nodes"}.
 */
public final class FlowTextExtractor {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final Pattern WORKFLOW_BLOCK =
        Pattern.compile("```WORKFLOW_JSON(?:\\s|Copy code)*([\\s\\S]*?)```", Pattern.CASE_INSENSITIVE);
    private static final Pattern JSON_BLOCK =
        Pattern.compile("```json(?:\\s|Copy code)*([\\s\\S]*?)```", Pattern.CASE_INSENSITIVE);

    private FlowTextExtractor() {}

    /**
     * @throws FatalInputException {@code no_workflow_found} when the text holds no workflow,
     *     {@code malformed_workflow_block} when the chosen block is not valid JSON
     */
    public static JsonNode extract(String text) {
        if (text == null || text.isBlank()) {
            throw noWorkflow();
        }
        var candidates = new ArrayList<Candidate>();
        collect(WORKFLOW_BLOCK, text, 100, candidates);
        collect(JSON_BLOCK, text, 0, candidates);
        var body = best(candidates);
        if (body == null) {
            body = bareObject(text);
        }
        if (body == null) {
            throw noWorkflow();
        }
        JsonNode root;
        try {
            root = JSON.readTree(body);
        } catch (JsonProcessingException ex) {
            throw new FatalInputException("malformed_workflow_block",
                "Workflow block is not valid JSON: " + ex.getOriginalMessage(), ex);
        }
        if (root == null || !root.isObject() || !root.path("nodes").isArray()) {
            throw noWorkflow();
        }
        return root;
    }

    private record Candidate(String body, double score) {}

    private static void collect(Pattern pattern, String text, double bonus, List<Candidate> candidates) {
        var matcher = pattern.matcher(text);
        while (matcher.find()) {
            var body = matcher.group(1).trim();
            double score = bonus + body.length() / 100.0;
            if (body.contains("\"nodes\"")) {
                score += 50;
            }
            if (body.contains("\"connections\"")) {
                score += 30;
            }
            candidates.add(new Candidate(body, score));
        }
    }

    private static String best(List<Candidate> candidates) {
        Candidate best = null;
        for (var candidate : candidates) {
            if (!candidate.body().isEmpty() && (best == null || candidate.score() > best.score())) {
                best = candidate;
            }
        }
        return best == null ? null : best.body();
    }

    private static String bareObject(String text) {
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        var body = text.substring(start, end + 1);
        return body.contains("\"nodes\"") ? body : null;
    }

    private static FatalInputException noWorkflow() {
        return new FatalInputException("no_workflow_found", "No workflow document found in the text");
    }
}
