package work.lcod.flowguard.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "flowguard",
    description = "Validate and repair workflow documents before handing them to the execution engine.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = { ValidateCommand.class, AnalyzeCommand.class }
)
final class FlowGuardCommand implements Callable<Integer> {
    static final int USAGE_EXIT_CODE = 2;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return USAGE_EXIT_CODE;
    }
}
