package work.envctl.deploy;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.envctl.controlplane.ControlPlaneException;
import work.envctl.runtime.OperationContext;

/**
 * Re-reads a deployment the control plane has just acknowledged until it becomes visible. Only not-found
 * failures are retried; waits observe the operation's cancellation token.
 */
public final class ReadAfterWriteRetry {
    private static final Logger log = LoggerFactory.getLogger(ReadAfterWriteRetry.class);

    private final RetryPolicy policy;

    public ReadAfterWriteRetry(RetryPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public DeploymentRecord await(String deploymentName, Supplier<DeploymentRecord> read, OperationContext context) {
        Duration delay = Duration.ZERO;
        ControlPlaneException last = null;
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            context.ensureNotCancelled();
            try {
                return read.get();
            } catch (ControlPlaneException ex) {
                if (!ex.isNotFound()) {
                    throw new DeploymentFailedException("deployment", deploymentName, ex);
                }
                last = ex;
            }
            if (attempt == policy.maxAttempts()) {
                break;
            }
            delay = policy.backoff().next(delay, policy.initialDelay(), policy.maxDelay());
            log.debug("Deployment {} not visible yet (attempt {}/{}), retrying in {} ms",
                deploymentName, attempt, policy.maxAttempts(), delay.toMillis());
            context.sleep(delay);
        }
        throw new DeploymentTimeoutException(deploymentName, policy.maxAttempts(), last);
    }
}
