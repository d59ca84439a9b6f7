package work.lcod.flowguard.cli;

import picocli.CommandLine;

/**
 * {@code --log-level}, shared by all subcommands.
 */
final class LoggingOptions {
    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = "warn"
    )
    private String logLevelRaw;

    void apply() {
        LogLevel.from(logLevelRaw).apply();
    }
}
