package work.lcod.flowguard.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.flowguard.analysis.ConnectivityAnalyzer;
import work.lcod.flowguard.policy.PortKindPolicy;

@CommandLine.Command(
    name = "analyze",
    description = "Print connectivity figures (depth, fan-out, orphans) of workflow documents.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class AnalyzeCommand implements Callable<Integer> {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private LoggingOptions logging;

    @CommandLine.Parameters(arity = "1..*", paramLabel = "FILE|-", description = "Workflow documents; '-' reads stdin.")
    private List<String> inputs = new ArrayList<>();

    @CommandLine.Option(
        names = "--catalog",
        description = "Node catalog TOML layered over the bundled catalog.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path catalog;

    @Override
    public Integer call() throws Exception {
        logging.apply();
        var commandLine = spec.commandLine();
        InputSources.requireReadable(commandLine, inputs);
        var analyzer = new ConnectivityAnalyzer(new PortKindPolicy(InputSources.catalog(catalog)));
        var out = commandLine.getOut();
        for (var input : inputs) {
            var document = InputSources.read(input);
            var payload = new LinkedHashMap<String, Object>();
            payload.put("source", InputSources.display(input));
            payload.putAll(analyzer.summary(document.graph()).toSerializableMap());
            if (!document.notices().isEmpty()) {
                payload.put("notices", document.notices());
            }
            out.println(JSON_WRITER.writeValueAsString(payload));
        }
        out.flush();
        return 0;
    }
}
