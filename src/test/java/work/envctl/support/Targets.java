package work.envctl.support;

import java.time.Duration;
import work.envctl.controlplane.ControlPlane;
import work.envctl.deploy.DeploymentTarget;
import work.envctl.deploy.ReadAfterWriteRetry;
import work.envctl.deploy.RetryPolicy;
import work.envctl.deploy.Scope;

public final class Targets {
    private Targets() {}

    public static RetryPolicy immediateRetry(int attempts) {
        return new RetryPolicy(attempts, Duration.ZERO, Duration.ZERO, (current, min, max) -> Duration.ZERO);
    }

    public static DeploymentTarget subscription(ControlPlane controlPlane) {
        return new DeploymentTarget(controlPlane, new Scope.Subscription("sub", "eastus"),
            new ReadAfterWriteRetry(immediateRetry(10)), "https://portal.test");
    }

    public static DeploymentTarget resourceGroup(ControlPlane controlPlane, String group) {
        return new DeploymentTarget(controlPlane, new Scope.ResourceGroup("sub", group),
            new ReadAfterWriteRetry(immediateRetry(10)), "https://portal.test");
    }
}
