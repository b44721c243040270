package work.envctl.api;

import java.util.Objects;

/**
 * Base type for failures surfaced to envctl callers. Every failure carries the {@link OperationStatus}
 * the CLI reports for it.
 */
public class EnvctlException extends RuntimeException {
    private final OperationStatus status;

    public EnvctlException(OperationStatus status, String message) {
        super(message);
        this.status = Objects.requireNonNull(status, "status");
    }

    public EnvctlException(OperationStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = Objects.requireNonNull(status, "status");
    }

    public OperationStatus status() {
        return status;
    }
}
