package work.envctl.deploy;

import work.envctl.api.EnvctlException;
import work.envctl.api.OperationStatus;

public final class DeploymentTimeoutException extends EnvctlException {
    private final int attempts;

    public DeploymentTimeoutException(String deploymentName, int attempts, Throwable lastFailure) {
        super(OperationStatus.TIMED_OUT,
            "Deployment '" + deploymentName + "' was not visible after " + attempts + " attempts", lastFailure);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
