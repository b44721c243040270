package work.envctl.config;

import work.envctl.api.EnvctlException;
import work.envctl.api.OperationStatus;

public final class ConfigStoreException extends EnvctlException {
    public ConfigStoreException(String message, Throwable cause) {
        super(OperationStatus.CONFIGURATION_ERROR, message, cause);
    }
}
