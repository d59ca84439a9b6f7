package work.lcod.flowguard.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import picocli.CommandLine;
import work.lcod.flowguard.catalog.MapNodeCatalog;
import work.lcod.flowguard.catalog.NodeCatalogLoader;
import work.lcod.flowguard.graph.FlowDocumentReader;
import work.lcod.flowguard.graph.FlowDocumentReader.ParsedDocument;

/**
 * Resolution of command-line inputs shared by the subcommands.
 */
final class InputSources {
    static final String STDIN = "-";

    private InputSources() {}

    static MapNodeCatalog catalog(Path override) {
        var bundled = NodeCatalogLoader.bundled();
        if (override == null) {
            return bundled;
        }
        return bundled.merge(NodeCatalogLoader.load(override));
    }

    static void requireReadable(CommandLine commandLine, List<String> inputs) {
        long stdinCount = inputs.stream().filter(STDIN::equals).count();
        if (stdinCount > 1) {
            throw new CommandLine.ParameterException(commandLine, "'-' (stdin) may be given only once.");
        }
        for (var input : inputs) {
            if (!STDIN.equals(input) && !Files.isRegularFile(Path.of(input))) {
                throw new CommandLine.ParameterException(commandLine, "Workflow document not found: " + input);
            }
        }
    }

    static ParsedDocument read(String input) {
        if (STDIN.equals(input)) {
            return FlowDocumentReader.read(System.in);
        }
        return FlowDocumentReader.readPath(Path.of(input));
    }

    static String text(String input) throws IOException {
        if (STDIN.equals(input)) {
            return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(Path.of(input), StandardCharsets.UTF_8);
    }

    static Optional<Path> path(String input) {
        return STDIN.equals(input) ? Optional.empty() : Optional.of(Path.of(input));
    }

    static String display(String input) {
        return STDIN.equals(input) ? "<stdin>" : input;
    }
}
