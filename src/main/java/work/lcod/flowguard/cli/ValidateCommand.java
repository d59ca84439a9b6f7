package work.lcod.flowguard.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.flowguard.api.FlowValidator;
import work.lcod.flowguard.api.ValidationOptions;
import work.lcod.flowguard.api.ValidationReport;
import work.lcod.flowguard.config.ValidationOptionsLoader;
import work.lcod.flowguard.graph.FlowDocumentWriter;

@CommandLine.Command(
    name = "validate",
    description = "Validate workflow documents and repair a copy of them.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ValidateCommand implements Callable<Integer> {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private LoggingOptions logging;

    @CommandLine.Parameters(
        arity = "1..*",
        paramLabel = "FILE|-",
        description = "Workflow documents (JSON, or YAML by .yaml/.yml extension); '-' reads stdin."
    )
    private List<String> inputs = new ArrayList<>();

    @CommandLine.Option(names = "--no-repair", description = "Only validate; do not run the repair pipeline.")
    private boolean noRepair;

    @CommandLine.Option(
        names = "--config",
        description = "Options file (default: ./flowguard.toml when present).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = "--catalog",
        description = "Node catalog TOML layered over the bundled catalog.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path catalog;

    @CommandLine.Option(
        names = "--placeholder-credentials",
        description = "Attach placeholder credentials to steps that require credentials."
    )
    private boolean placeholderCredentials;

    @CommandLine.Option(
        names = "--extract",
        description = "Treat inputs as free text and validate the workflow block embedded in them."
    )
    private boolean extract;

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Write the normalized document to this file (single input only).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path output;

    @Override
    public Integer call() throws Exception {
        logging.apply();
        var commandLine = spec.commandLine();
        InputSources.requireReadable(commandLine, inputs);
        if (output != null && inputs.size() > 1) {
            throw new CommandLine.ParameterException(commandLine, "--output requires exactly one input document.");
        }

        var validator = new FlowValidator(InputSources.catalog(catalog), resolveOptions());
        int exitCode = 0;
        var out = commandLine.getOut();
        for (var input : inputs) {
            var report = extract
                ? validator.validateText(InputSources.text(input))
                : InputSources.path(input).map(validator::validate).orElseGet(() -> validator.validate(System.in));
            exitCode = Math.max(exitCode, report.exitCode());

            var payload = new LinkedHashMap<String, Object>();
            payload.put("source", InputSources.display(input));
            payload.putAll(report.toSerializableMap());
            out.println(JSON_WRITER.writeValueAsString(payload));
            writeOutput(report);
        }
        out.flush();
        return exitCode;
    }

    private ValidationOptions resolveOptions() {
        var base = ValidationOptions.defaults();
        var configPath = config != null
            ? Optional.of(config)
            : ValidationOptionsLoader.discover(Path.of("").toAbsolutePath());
        var options = configPath.map(path -> ValidationOptionsLoader.load(path, base)).orElse(base).toBuilder();
        if (noRepair) {
            options.autofix(false);
        }
        if (placeholderCredentials) {
            options.placeholderCredentials(true);
        }
        return options.build();
    }

    private void writeOutput(ValidationReport report) throws IOException {
        if (output == null || report.normalized().isEmpty()) {
            return;
        }
        var parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, FlowDocumentWriter.toPrettyJson(report.normalized().get()) + System.lineSeparator(),
            StandardCharsets.UTF_8);
    }
}
