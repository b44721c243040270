package work.envctl.config;

/**
 * Well-known environment store keys.
 */
public final class EnvironmentKeys {
    public static final String ENV_NAME = "AZURE_ENV_NAME";
    public static final String LOCATION = "AZURE_LOCATION";
    public static final String RESOURCE_GROUP = "AZURE_RESOURCE_GROUP";
    public static final String SUBSCRIPTION_ID = "AZURE_SUBSCRIPTION_ID";

    public static final String PARAMETER_PREFIX = "infra.parameters.";

    private EnvironmentKeys() {}

    public static String parameterKey(String parameterName) {
        return PARAMETER_PREFIX + parameterName;
    }
}
