package work.envctl.deploy;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.envctl.controlplane.ControlPlaneException;
import work.envctl.params.ResolvedParameters;
import work.envctl.runtime.OperationContext;
import work.envctl.template.Template;

/**
 * Issues one deployment with progress reporting and turns the finished record into template outputs.
 */
public final class Deployer {
    private static final Logger log = LoggerFactory.getLogger(Deployer.class);

    private final Clock clock;
    private final BiFunction<DeploymentTarget, String, ProgressReporter> reporters;

    public Deployer(Clock clock, Consumer<String> progressSink) {
        this(clock, progressReporters(progressSink));
    }

    Deployer(Clock clock, BiFunction<DeploymentTarget, String, ProgressReporter> reporters) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.reporters = Objects.requireNonNull(reporters, "reporters");
    }

    private static BiFunction<DeploymentTarget, String, ProgressReporter> progressReporters(Consumer<String> progressSink) {
        Objects.requireNonNull(progressSink, "progressSink");
        return (target, deploymentName) -> new ProgressReporter(target, deploymentName, progressSink);
    }

    public DeployResult deploy(
        DeploymentTarget target,
        Template template,
        ResolvedParameters parameters,
        String environmentName,
        Map<String, String> extraTags,
        OperationContext context
    ) {
        String deploymentName = DeploymentNames.generate(environmentName, clock);
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put(DeploymentTags.ENV_NAME, environmentName);
        tags.putAll(extraTags);

        log.info("Deploying {} to {}", deploymentName, target.describe());
        DeploymentRecord record;
        try (ProgressReporter progress = reporters.apply(target, deploymentName)) {
            progress.start();
            record = target.deploy(deploymentName, template.artifact(), parameters.toPlainMap(), tags, context);
        }
        if (record.state() == ProvisioningState.FAILED) {
            throw new DeploymentFailedException("deployment", deploymentName,
                new ControlPlaneException("Deployment finished in state " + record.state().displayName()
                    + ". See " + target.deploymentPortalUrl(record.id() == null ? deploymentName : record.id())));
        }
        return new DeployResult(record, DeploymentTarget.mapOutputs(template, record), false, "deployed");
    }
}
