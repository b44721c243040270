package work.envctl.state;

import java.util.Optional;
import work.envctl.deploy.DeploymentRecord;

/**
 * Outcome of the state check. {@code parameterHash} is what the next deployment should be tagged with,
 * when it could be computed.
 */
public record SkipDecision(boolean skip, String reason, Optional<DeploymentRecord> prior, Optional<String> parameterHash) {
    public static final String SKIPPED = "skipped";

    public static SkipDecision skipped(DeploymentRecord prior, String parameterHash) {
        return new SkipDecision(true, SKIPPED, Optional.of(prior), Optional.of(parameterHash));
    }

    public static SkipDecision deploy(String reason, Optional<String> parameterHash) {
        return new SkipDecision(false, reason, Optional.empty(), parameterHash);
    }
}
