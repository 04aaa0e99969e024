package work.lcod.strata.cli;

import java.io.IOException;
import picocli.CommandLine;
import work.lcod.strata.format.ConfigSyntaxException;

/**
 * Prints one line per failure. Config files that cannot be parsed or read exit with
 * {@link #EXIT_LOAD_ERROR}; {@code -Dstrata.debug=true} adds the stack trace.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "strata.debug";
    static final int EXIT_LOAD_ERROR = 2;

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        int exitCode = commandLine.getCommandSpec().exitCodeOnExecutionException();
        String message;
        ConfigSyntaxException syntax = causeOfType(ex, ConfigSyntaxException.class);
        IOException unreadable = causeOfType(ex, IOException.class);
        if (syntax != null) {
            message = "config error: " + syntax.getMessage();
            exitCode = EXIT_LOAD_ERROR;
        } else if (unreadable != null) {
            message = "load error: " + ex.getMessage();
            exitCode = EXIT_LOAD_ERROR;
        } else {
            message = ex.getMessage();
            if (message == null || message.isBlank()) {
                message = ex.getClass().getSimpleName();
            }
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText(message));
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            ex.printStackTrace(commandLine.getErr());
        }
        return exitCode;
    }

    private static <T extends Throwable> T causeOfType(Throwable error, Class<T> type) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
        }
        return null;
    }
}
