package work.envctl.deploy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.envctl.controlplane.ControlPlaneException;
import work.envctl.runtime.OperationContext;
import work.envctl.support.FakeControlPlane;
import work.envctl.support.Targets;
import work.envctl.support.Templates;
import work.envctl.template.OutputDefinition;
import work.envctl.template.ParameterType;
import work.envctl.template.TargetScope;

class DeploymentTargetTest {
    @Test
    void mapsOutputsCaseInsensitivelyWithTemplateCasing() {
        var template = Templates.of(TargetScope.SUBSCRIPTION, Map.of(
            "WEBSITE_URL", new OutputDefinition("WEBSITE_URL", ParameterType.STRING),
            "replicaCount", new OutputDefinition("replicaCount", ParameterType.NUMBER)
        ));
        var record = new DeploymentRecord("id", "dev-1", "eastus", ProvisioningState.SUCCEEDED, Instant.EPOCH, Map.of(), "h",
            Map.of(
                "website_url", new DeploymentOutput("String", "https://app"),
                "ReplicaCount", new DeploymentOutput("Int", 3),
                "undeclared", new DeploymentOutput("String", "x")
            ), List.of(), List.of());

        var outputs = DeploymentTarget.mapOutputs(template, record);

        assertEquals(2, outputs.size());
        assertEquals(new DeploymentOutput("string", "https://app"), outputs.get("WEBSITE_URL"));
        assertEquals(new DeploymentOutput("number", 3), outputs.get("replicaCount"));
    }

    @Test
    void deploymentPortalUrlEncodesTheId() {
        var target = Targets.subscription(new FakeControlPlane());

        assertEquals(
            "https://portal.test/#view/HubsExtension/DeploymentDetailsBlade/~/overview/id/%2Fsubscriptions%2Fsub%2Fdeployments%2Fdev-1",
            target.deploymentPortalUrl("/subscriptions/sub/deployments/dev-1")
        );
    }

    @Test
    void submissionFailureIsReportedAsDeploymentFailure() {
        var controlPlane = new FakeControlPlane();
        controlPlane.deployFailure = new ControlPlaneException("InvalidTemplate");
        var target = Targets.resourceGroup(controlPlane, "rg-dev");

        var ex = assertThrows(DeploymentFailedException.class,
            () -> target.deploy("dev-1", new byte[0], Map.of(), Map.of(), new OperationContext()));
        assertEquals("dev-1", ex.resourceName());
        assertEquals(0, controlPlane.getDeploymentCalls.get());
    }

    @Test
    void previewRoutesToScope() {
        var target = Targets.resourceGroup(new FakeControlPlane(), "rg-dev");

        assertEquals(1, target.deployPreview("dev-1", new byte[0], Map.of()).size());
        assertEquals("resource group rg-dev (subscription sub)", target.describe());
    }
}
