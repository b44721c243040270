package work.envctl.destroy;

import java.util.List;
import java.util.Objects;
import work.envctl.deploy.DeploymentRecord;

/**
 * What a destroy pass removed. {@code invalidatedKeys} are the environment keys that no longer describe
 * live infrastructure.
 */
public record DestroyResult(
    DeploymentRecord deployment,
    List<String> deletedResourceGroups,
    List<PurgeOutcome> purgeOutcomes,
    List<String> invalidatedKeys
) {
    public DestroyResult {
        Objects.requireNonNull(deployment, "deployment");
        deletedResourceGroups = List.copyOf(deletedResourceGroups);
        purgeOutcomes = List.copyOf(purgeOutcomes);
        invalidatedKeys = List.copyOf(invalidatedKeys);
    }
}
