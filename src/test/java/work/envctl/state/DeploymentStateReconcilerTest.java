package work.envctl.state;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.envctl.controlplane.ControlPlaneException;
import work.envctl.deploy.DeploymentRecord;
import work.envctl.deploy.DeploymentTags;
import work.envctl.deploy.DeploymentTarget;
import work.envctl.deploy.ProvisioningState;
import work.envctl.params.ResolvedParameters;
import work.envctl.support.FakeControlPlane;
import work.envctl.support.Targets;
import work.envctl.support.Templates;
import work.envctl.template.ParameterDefinition;
import work.envctl.template.ParameterType;
import work.envctl.template.ParameterValue;
import work.envctl.template.Template;

class DeploymentStateReconcilerTest {
    private final Template template = Templates.of(ParameterDefinition.builder("name", ParameterType.STRING).build());
    private final ResolvedParameters parameters = new ResolvedParameters(Map.of("name", ParameterValue.of("app")));

    private FakeControlPlane controlPlane;
    private DeploymentTarget target;
    private DeploymentStateReconciler reconciler;
    private String parameterHash;

    @BeforeEach
    void setUp() {
        controlPlane = new FakeControlPlane();
        target = Targets.subscription(controlPlane);
        reconciler = new DeploymentStateReconciler(controlPlane);
        parameterHash = ParameterHasher.hash(template, parameters);
    }

    @Test
    void skipsWhenTemplateAndParametersAreUnchanged() {
        var prior = prior(ProvisioningState.SUCCEEDED, "template-hash", parameterHash);
        controlPlane.deployments.add(prior);

        var decision = reconciler.evaluate(target, template, parameters, "dev", false);

        assertTrue(decision.skip());
        assertEquals(SkipDecision.SKIPPED, decision.reason());
        assertEquals(prior, decision.prior().orElseThrow());
    }

    @Test
    void deploysWhenParametersChanged() {
        controlPlane.deployments.add(prior(ProvisioningState.SUCCEEDED, "template-hash", "other"));

        var decision = reconciler.evaluate(target, template, parameters, "dev", false);

        assertFalse(decision.skip());
        assertEquals(parameterHash, decision.parameterHash().orElseThrow());
    }

    @Test
    void deploysWhenTemplateChanged() {
        controlPlane.deployments.add(prior(ProvisioningState.SUCCEEDED, "old-template", parameterHash));

        assertFalse(reconciler.evaluate(target, template, parameters, "dev", false).skip());
    }

    @Test
    void deploysWhenPriorDidNotSucceed() {
        controlPlane.deployments.add(prior(ProvisioningState.FAILED, "template-hash", parameterHash));

        var decision = reconciler.evaluate(target, template, parameters, "dev", false);

        assertFalse(decision.skip());
        assertEquals("last deployment Failed", decision.reason());
    }

    @Test
    void deploysWhenNoPriorDeploymentExists() {
        var decision = reconciler.evaluate(target, template, parameters, "dev", false);

        assertFalse(decision.skip());
        assertEquals("cannot determine state", decision.reason());
    }

    @Test
    void deploysWhenLookupFails() {
        controlPlane.deployments.add(prior(ProvisioningState.SUCCEEDED, "template-hash", parameterHash));
        controlPlane.listFailure = new ControlPlaneException("throttled");

        assertFalse(reconciler.evaluate(target, template, parameters, "dev", false).skip());
    }

    @Test
    void ignoringStateStillComputesTheHash() {
        controlPlane.deployments.add(prior(ProvisioningState.SUCCEEDED, "template-hash", parameterHash));

        var decision = reconciler.evaluate(target, template, parameters, "dev", true);

        assertFalse(decision.skip());
        assertEquals(parameterHash, decision.parameterHash().orElseThrow());
        assertEquals(0, controlPlane.listDeploymentCalls.get());
    }

    private static DeploymentRecord prior(ProvisioningState state, String templateHash, String parametersHash) {
        return new DeploymentRecord("/deployments/dev-1", "dev-1", "eastus", state, Instant.parse("2024-01-01T00:00:00Z"),
            Map.of(DeploymentTags.ENV_NAME, "dev", DeploymentTags.PARAMS_HASH, parametersHash), templateHash,
            Map.of(), null, null);
    }
}
