package work.envctl.deploy;

/**
 * Tag keys envctl writes onto deployments.
 */
public final class DeploymentTags {
    public static final String ENV_NAME = "envctl-env-name";
    public static final String PARAMS_HASH = "envctl-params-hash";
    public static final String DEPLOY_REASON = "envctl-deploy-reason";
    public static final String REASON_DOWN = "down";

    private DeploymentTags() {}
}
