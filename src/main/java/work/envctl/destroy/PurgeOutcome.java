package work.envctl.destroy;

import java.util.Objects;

public record PurgeOutcome(PurgeKind kind, String resourceName, Status status) {
    public PurgeOutcome {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(resourceName, "resourceName");
        Objects.requireNonNull(status, "status");
    }

    public enum Status {
        PURGED,
        SKIPPED,
        PROTECTED
    }
}
