package work.envctl.console;

import work.envctl.api.EnvctlException;
import work.envctl.api.OperationStatus;

public final class UserDeniedException extends EnvctlException {
    public UserDeniedException(String message) {
        super(OperationStatus.DENIED, message);
    }
}
