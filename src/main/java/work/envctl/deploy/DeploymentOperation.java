package work.envctl.deploy;

import java.time.Instant;
import java.util.Objects;

/**
 * A resource-level operation inside a running deployment, used for progress reporting.
 */
public record DeploymentOperation(
    String operationId,
    String resourceType,
    String resourceName,
    ProvisioningState state,
    Instant timestamp
) {
    public DeploymentOperation {
        Objects.requireNonNull(operationId, "operationId");
        Objects.requireNonNull(resourceType, "resourceType");
        Objects.requireNonNull(resourceName, "resourceName");
        Objects.requireNonNull(state, "state");
    }
}
