package work.envctl.deploy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.envctl.support.FakeControlPlane;
import work.envctl.support.ScriptedConsole;
import work.envctl.support.Targets;

class DeploymentLocatorTest {
    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private FakeControlPlane controlPlane;
    private DeploymentTarget target;

    @BeforeEach
    void setUp() {
        controlPlane = new FakeControlPlane();
        target = Targets.subscription(controlPlane);
    }

    @Test
    void taggedDeploymentWinsOverNewerExactName() {
        var tagged = FakeControlPlane.record("dev-1709287200", ProvisioningState.SUCCEEDED, T0,
            Map.of(DeploymentTags.ENV_NAME, "dev"));
        var named = FakeControlPlane.record("dev", ProvisioningState.SUCCEEDED, T0.plusSeconds(3600), Map.of());
        controlPlane.deployments.addAll(List.of(named, tagged));

        assertEquals(tagged, new DeploymentLocator(null).locate(target, "dev", "dev"));
    }

    @Test
    void newestTaggedDeploymentIsReturned() {
        var older = FakeControlPlane.record("dev-1", ProvisioningState.SUCCEEDED, T0, Map.of(DeploymentTags.ENV_NAME, "dev"));
        var newer = FakeControlPlane.record("dev-2", ProvisioningState.FAILED, T0.plusSeconds(60), Map.of(DeploymentTags.ENV_NAME, "dev"));
        controlPlane.deployments.addAll(List.of(older, newer));

        assertEquals(newer, new DeploymentLocator(null).locate(target, "dev", "dev"));
    }

    @Test
    void exactNameIsUsedWithoutTags() {
        var named = FakeControlPlane.record("dev", ProvisioningState.SUCCEEDED, T0, Map.of());
        var other = FakeControlPlane.record("dev-old", ProvisioningState.SUCCEEDED, T0.plusSeconds(5), Map.of());
        controlPlane.deployments.addAll(List.of(named, other));

        assertEquals(named, new DeploymentLocator(null).locate(target, "dev", "dev"));
    }

    @Test
    void singleSubstringMatchAmongTerminalDeployments() {
        var running = FakeControlPlane.record("dev-running", ProvisioningState.RUNNING, T0.plusSeconds(60), Map.of());
        var done = FakeControlPlane.record("dev-done", ProvisioningState.SUCCEEDED, T0, Map.of());
        controlPlane.deployments.addAll(List.of(running, done));

        assertEquals(done, new DeploymentLocator(null).locate(target, "dev", "dev"));
    }

    @Test
    void noMatchRaisesNoDeploymentsFound() {
        controlPlane.deployments.add(FakeControlPlane.record("prod-1", ProvisioningState.SUCCEEDED, T0, Map.of()));

        assertThrows(NoDeploymentsFoundException.class, () -> new DeploymentLocator(null).locate(target, "dev", "dev"));
    }

    @Test
    void ambiguousWithoutConsole() {
        controlPlane.deployments.add(FakeControlPlane.record("dev-1", ProvisioningState.SUCCEEDED, T0, Map.of()));
        controlPlane.deployments.add(FakeControlPlane.record("dev-2", ProvisioningState.FAILED, T0.plusSeconds(1), Map.of()));

        assertThrows(AmbiguousDeploymentException.class, () -> new DeploymentLocator(null).locate(target, "dev", "dev"));
    }

    @Test
    void consoleChoosesAmongSeveralMatches() {
        var first = FakeControlPlane.record("dev-1", ProvisioningState.SUCCEEDED, T0, Map.of());
        var second = FakeControlPlane.record("dev-2", ProvisioningState.FAILED, T0.plusSeconds(60), Map.of());
        controlPlane.deployments.addAll(List.of(first, second));
        var console = new ScriptedConsole().answerSelect(1);

        assertEquals(first, new DeploymentLocator(console).locate(target, "dev", "dev"));
        assertEquals(List.of("dev-2 (2024-03-01 10:01:00)", "dev-1 (2024-03-01 10:00:00)"), console.selectOptions.get(0));
    }
}
