package work.envctl.console;

import work.envctl.api.EnvctlException;
import work.envctl.api.OperationStatus;

/**
 * The console could not read an answer (closed input, no terminal).
 */
public final class ConsoleException extends EnvctlException {
    public ConsoleException(String message) {
        super(OperationStatus.CANCELLED, message);
    }

    public ConsoleException(String message, Throwable cause) {
        super(OperationStatus.CANCELLED, message, cause);
    }
}
