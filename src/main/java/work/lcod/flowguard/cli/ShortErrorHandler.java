package work.lcod.flowguard.cli;

import picocli.CommandLine;
import work.lcod.flowguard.api.FlowValidator;
import work.lcod.flowguard.graph.FatalInputException;

/**
 * Prints the root cause of a failed command on one line; stack traces only with
 * {@code -Dflowguard.debug=true}.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        if (ex instanceof FatalInputException fatal) {
            message = message + " [" + fatal.code() + "]";
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText(message));
        if (Boolean.getBoolean(FlowValidator.DEBUG_PROPERTY)) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
