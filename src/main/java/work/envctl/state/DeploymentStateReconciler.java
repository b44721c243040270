package work.envctl.state;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.envctl.api.EnvctlException;
import work.envctl.controlplane.ControlPlane;
import work.envctl.controlplane.ControlPlaneException;
import work.envctl.deploy.DeploymentLocator;
import work.envctl.deploy.DeploymentRecord;
import work.envctl.deploy.DeploymentTags;
import work.envctl.deploy.DeploymentTarget;
import work.envctl.deploy.ProvisioningState;
import work.envctl.params.ResolvedParameters;
import work.envctl.template.Template;

/**
 * Decides whether a deployment can be skipped because the last successful one used the same template and
 * parameter values. Any doubt means deploy.
 */
public final class DeploymentStateReconciler {
    private static final Logger log = LoggerFactory.getLogger(DeploymentStateReconciler.class);

    private final ControlPlane controlPlane;
    private final DeploymentLocator locator;

    public DeploymentStateReconciler(ControlPlane controlPlane) {
        this.controlPlane = controlPlane;
        this.locator = new DeploymentLocator(null);
    }

    public SkipDecision evaluate(
        DeploymentTarget target,
        Template template,
        ResolvedParameters parameters,
        String environmentName,
        boolean ignoreState
    ) {
        Optional<String> parameterHash = computeHash(template, parameters);
        if (ignoreState) {
            return SkipDecision.deploy("state check disabled", parameterHash);
        }
        if (parameterHash.isEmpty()) {
            return SkipDecision.deploy("parameter hash unavailable", parameterHash);
        }

        DeploymentRecord prior;
        String templateHash;
        try {
            templateHash = controlPlane.calculateTemplateHash(target.scope().subscriptionId(), template.artifact());
            prior = locator.locate(target, environmentName, environmentName);
        } catch (EnvctlException | ControlPlaneException ex) {
            log.debug("Cannot determine deployment state for {}: {}", environmentName, ex.getMessage());
            return SkipDecision.deploy("cannot determine state", parameterHash);
        }

        if (prior.state() != ProvisioningState.SUCCEEDED) {
            return SkipDecision.deploy("last deployment " + prior.state().displayName(), parameterHash);
        }
        if (prior.templateHashValue().filter(templateHash::equals).isEmpty()) {
            return SkipDecision.deploy("template changed", parameterHash);
        }
        if (prior.tag(DeploymentTags.PARAMS_HASH).filter(parameterHash.get()::equals).isEmpty()) {
            return SkipDecision.deploy("parameters changed", parameterHash);
        }
        log.info("Skipping deployment: {} is up to date", prior.name());
        return SkipDecision.skipped(prior, parameterHash.get());
    }

    private static Optional<String> computeHash(Template template, ResolvedParameters parameters) {
        try {
            return Optional.of(ParameterHasher.hash(template, parameters));
        } catch (IllegalStateException ex) {
            log.warn("Could not hash parameters, forcing a deployment: {}", ex.getMessage());
            return Optional.empty();
        }
    }
}
