package work.envctl.deploy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import work.envctl.controlplane.ControlPlaneException;
import work.envctl.runtime.OperationCancelledException;
import work.envctl.runtime.OperationContext;
import work.envctl.support.FakeControlPlane;
import work.envctl.support.Targets;

class ReadAfterWriteRetryTest {
    private final DeploymentRecord record =
        FakeControlPlane.record("dev-1", ProvisioningState.SUCCEEDED, Instant.parse("2024-01-01T00:00:00Z"), Map.of());

    @Test
    void returnsOnceDeploymentBecomesVisible() {
        var reads = new AtomicInteger();
        var retry = new ReadAfterWriteRetry(Targets.immediateRetry(10));

        var result = retry.await("dev-1", () -> {
            if (reads.incrementAndGet() <= 7) {
                throw ControlPlaneException.notFound("not yet");
            }
            return record;
        }, new OperationContext());

        assertEquals(record, result);
        assertEquals(8, reads.get());
    }

    @Test
    void timesOutAfterExactlyMaxAttempts() {
        var reads = new AtomicInteger();
        var retry = new ReadAfterWriteRetry(Targets.immediateRetry(10));

        var ex = assertThrows(DeploymentTimeoutException.class, () -> retry.await("dev-1", () -> {
            reads.incrementAndGet();
            throw ControlPlaneException.notFound("not yet");
        }, new OperationContext()));

        assertEquals(10, reads.get());
        assertEquals(10, ex.attempts());
    }

    @Test
    void otherFailuresAreNotRetried() {
        var reads = new AtomicInteger();
        var retry = new ReadAfterWriteRetry(Targets.immediateRetry(10));

        var ex = assertThrows(DeploymentFailedException.class, () -> retry.await("dev-1", () -> {
            reads.incrementAndGet();
            throw new ControlPlaneException("forbidden");
        }, new OperationContext()));

        assertEquals(1, reads.get());
        assertTrue(ex.getMessage().contains("forbidden"));
    }

    @Test
    void cancellationInterruptsTheWait() {
        var context = new OperationContext();
        var policy = new RetryPolicy(10, Duration.ofMinutes(5), Duration.ofMinutes(5), (current, min, max) -> min);
        var retry = new ReadAfterWriteRetry(policy);
        var reads = new AtomicInteger();

        long started = System.nanoTime();
        assertThrows(OperationCancelledException.class, () -> retry.await("dev-1", () -> {
            reads.incrementAndGet();
            context.cancel();
            throw ControlPlaneException.notFound("not yet");
        }, context));

        assertEquals(1, reads.get());
        assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(30)) < 0);
    }

    @Test
    void deploymentTargetWaitsForReadAfterWrite() {
        var controlPlane = new FakeControlPlane();
        var target = Targets.subscription(controlPlane);
        controlPlane.notFoundReads = 3;

        var deployed = target.deploy("dev-1", new byte[0], Map.of(), Map.of(DeploymentTags.ENV_NAME, "dev"), new OperationContext());

        assertEquals("dev-1", deployed.name());
        assertEquals(4, controlPlane.getDeploymentCalls.get());
        assertEquals(1, controlPlane.deployCalls.size());
    }
}
