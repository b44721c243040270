package work.envctl.deploy;

import work.envctl.api.EnvctlException;
import work.envctl.api.OperationStatus;

/**
 * Several deployments match and no one is around to pick one.
 */
public final class AmbiguousDeploymentException extends EnvctlException {
    public AmbiguousDeploymentException(String environmentName, int candidates) {
        super(OperationStatus.NO_DEPLOYMENTS,
            candidates + " deployments match environment '" + environmentName + "' and none is tagged with it");
    }
}
