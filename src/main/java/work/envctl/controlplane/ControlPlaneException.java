package work.envctl.controlplane;

/**
 * Failure reported by the control plane. Not-found responses are flagged so callers can tell eventual
 * consistency lag and already-deleted resources apart from hard failures.
 */
public class ControlPlaneException extends RuntimeException {
    private final boolean notFound;

    public ControlPlaneException(String message) {
        this(message, false, null);
    }

    public ControlPlaneException(String message, Throwable cause) {
        this(message, false, cause);
    }

    public ControlPlaneException(String message, boolean notFound, Throwable cause) {
        super(message, cause);
        this.notFound = notFound;
    }

    public static ControlPlaneException notFound(String message) {
        return new ControlPlaneException(message, true, null);
    }

    public boolean isNotFound() {
        return notFound;
    }
}
