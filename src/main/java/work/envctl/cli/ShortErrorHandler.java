package work.envctl.cli;

import picocli.CommandLine;
import work.envctl.api.EnvctlException;

/**
 * Keeps CLI failures short and focused on the root cause. envctl failures exit with their status code.
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
        commandLine.getErr().println(commandLine.getColorScheme().errorText(message));
        if (Boolean.getBoolean("envctl.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        if (ex instanceof EnvctlException envctl) {
            return envctl.status().exitCode();
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
