package work.envctl.runtime;

import work.envctl.api.EnvctlException;
import work.envctl.api.OperationStatus;

public final class OperationCancelledException extends EnvctlException {
    public OperationCancelledException(String message) {
        super(OperationStatus.CANCELLED, message);
    }
}
