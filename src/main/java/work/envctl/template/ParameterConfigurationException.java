package work.envctl.template;

import work.envctl.api.EnvctlException;
import work.envctl.api.OperationStatus;

/**
 * Fatal problem in how a template declares its parameters (unknown types, dependency cycles, references to
 * undeclared parameters, defaults outside the allowed values). Never retried.
 */
public final class ParameterConfigurationException extends EnvctlException {
    public ParameterConfigurationException(String message) {
        super(OperationStatus.CONFIGURATION_ERROR, message);
    }
}
