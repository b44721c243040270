package work.envctl.api;

/**
 * Caller-visible outcome of an envctl operation and the process exit code it maps to.
 */
public enum OperationStatus {
    SUCCESS(0),
    DEPLOYMENT_FAILED(1),
    DENIED(2),
    TIMED_OUT(3),
    NO_DEPLOYMENTS(4),
    CONFIGURATION_ERROR(5),
    CANCELLED(130);

    private final int exitCode;

    OperationStatus(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
