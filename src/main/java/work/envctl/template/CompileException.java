package work.envctl.template;

import work.envctl.api.EnvctlException;
import work.envctl.api.OperationStatus;

public final class CompileException extends EnvctlException {
    public CompileException(String message) {
        super(OperationStatus.CONFIGURATION_ERROR, message);
    }

    public CompileException(String message, Throwable cause) {
        super(OperationStatus.CONFIGURATION_ERROR, message, cause);
    }
}
