package work.envctl.deploy;

import work.envctl.api.EnvctlException;
import work.envctl.api.OperationStatus;

public final class NoDeploymentsFoundException extends EnvctlException {
    public NoDeploymentsFoundException(String environmentName) {
        super(OperationStatus.NO_DEPLOYMENTS, "No deployments found for environment '" + environmentName + "'");
    }
}
