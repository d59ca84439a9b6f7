package work.lcod.flowguard.api;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.flowguard.analysis.ConnectivityAnalyzer;
import work.lcod.flowguard.analysis.ConnectivitySummary;
import work.lcod.flowguard.catalog.NodeCatalog;
import work.lcod.flowguard.catalog.NodeCatalogLoader;
import work.lcod.flowguard.graph.FatalInputException;
import work.lcod.flowguard.graph.FlowDocumentReader;
import work.lcod.flowguard.graph.FlowDocumentReader.ParsedDocument;
import work.lcod.flowguard.graph.FlowGraph;
import work.lcod.flowguard.policy.PortKindPolicy;
import work.lcod.flowguard.repair.RepairPipeline;
import work.lcod.flowguard.validation.StructuralValidator;

/**
 * Public entry point: validates a workflow, optionally repairs a private copy of it and
 * re-validates the result.
 *
 * <p>Instances hold only immutable collaborators and may be shared between threads.
 */
public final class FlowValidator {
    public static final String DEBUG_PROPERTY = "flowguard.debug";
    private static final Logger log = LoggerFactory.getLogger(FlowValidator.class);

    private final PortKindPolicy policy;
    private final ValidationOptions options;
    private final StructuralValidator validator;
    private final ConnectivityAnalyzer analyzer;
    private final RepairPipeline pipeline;

    public FlowValidator() {
        this(NodeCatalogLoader.bundled(), ValidationOptions.defaults());
    }

    public FlowValidator(NodeCatalog catalog, ValidationOptions options) {
        this(catalog, options, RepairPipeline.standard());
    }

    public FlowValidator(NodeCatalog catalog, ValidationOptions options, RepairPipeline pipeline) {
        this.policy = new PortKindPolicy(catalog);
        this.options = Objects.requireNonNull(options, "options");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.validator = new StructuralValidator(policy);
        this.analyzer = new ConnectivityAnalyzer(policy);
    }

    public ValidationOptions options() {
        return options;
    }

    public PortKindPolicy policy() {
        return policy;
    }

    public ValidationReport validate(String json) {
        return guarded(() -> FlowDocumentReader.readJson(json));
    }

    /**
     * Validates the workflow embedded in free text, such as a fenced {@code WORKFLOW_JSON}
     * block in a generated answer.
     */
    public ValidationReport validateText(String text) {
        return guarded(() -> FlowDocumentReader.readText(text));
    }

    public ValidationReport validate(JsonNode document) {
        return guarded(() -> FlowDocumentReader.read(document));
    }

    /**
     * Reads a JSON or YAML document from the stream.
     */
    public ValidationReport validate(InputStream in) {
        return guarded(() -> FlowDocumentReader.read(in));
    }

    public ValidationReport validate(Path path) {
        return guarded(() -> FlowDocumentReader.readPath(path));
    }

    /**
     * Validates an already built graph. The graph is never modified.
     */
    public ValidationReport validate(FlowGraph graph) {
        return guarded(() -> new ParsedDocument(Objects.requireNonNull(graph, "graph"), List.of()));
    }

    public ConnectivitySummary analyze(FlowGraph graph) {
        return analyzer.summary(graph);
    }

    private ValidationReport guarded(Supplier<ParsedDocument> source) {
        try {
            var document = source.get();
            return check(document.graph(), document.notices());
        } catch (FatalInputException ex) {
            log.debug("Rejected workflow document [{}]: {}", ex.code(), ex.getMessage());
            return ValidationReport.fatal(ex.getMessage());
        } catch (Exception ex) {
            log.warn("Validation aborted: {}", ex.toString());
            if (Boolean.getBoolean(DEBUG_PROPERTY)) {
                ex.printStackTrace();
            }
            var message = ex.getMessage() == null || ex.getMessage().isBlank()
                ? ex.getClass().getSimpleName()
                : ex.getMessage();
            return ValidationReport.fatal("Validation failed: " + message);
        }
    }

    private ValidationReport check(FlowGraph graph, List<String> notices) {
        var initial = validator.validate(graph);
        var warnings = new LinkedHashSet<String>(notices);
        warnings.addAll(initial.warnings());
        log.debug("Initial check: {} error(s), {} warning(s)", initial.errors().size(), initial.warnings().size());

        if (!options.autofix()) {
            return new ValidationReport(
                initial.isValid(),
                initial.errors(),
                new ArrayList<>(warnings),
                List.of(),
                false,
                Optional.of(graph.deepCopy())
            );
        }

        var repaired = pipeline.repair(graph, policy, options);
        var finalIssues = repaired.changed() ? validator.validate(repaired.graph()) : initial;
        warnings.addAll(finalIssues.warnings());
        if (repaired.changed()) {
            log.info("Applied {} fix(es); {} error(s) remain", repaired.fixes().size(), finalIssues.errors().size());
        }
        return new ValidationReport(
            finalIssues.isValid(),
            finalIssues.errors(),
            new ArrayList<>(warnings),
            repaired.fixes(),
            repaired.changed(),
            Optional.of(repaired.changed() ? repaired.graph() : graph.deepCopy())
        );
    }
}
