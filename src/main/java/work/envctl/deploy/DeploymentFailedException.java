package work.envctl.deploy;

import work.envctl.api.EnvctlException;
import work.envctl.api.OperationStatus;
import work.envctl.controlplane.ControlPlaneException;

/**
 * A control-plane call failed while working on a named resource.
 */
public final class DeploymentFailedException extends EnvctlException {
    private final String resourceType;
    private final String resourceName;

    public DeploymentFailedException(String resourceType, String resourceName, ControlPlaneException cause) {
        super(OperationStatus.DEPLOYMENT_FAILED,
            "Failed on " + resourceType + " '" + resourceName + "': " + cause.getMessage(), cause);
        this.resourceType = resourceType;
        this.resourceName = resourceName;
    }

    public String resourceType() {
        return resourceType;
    }

    public String resourceName() {
        return resourceName;
    }
}
