package work.envctl.deploy;

import java.util.Objects;

/**
 * A change a deployment would make, as predicted by a preview.
 */
public record WhatIfChange(ChangeType changeType, String resourceId, String resourceType) {
    public WhatIfChange {
        Objects.requireNonNull(changeType, "changeType");
        Objects.requireNonNull(resourceId, "resourceId");
        Objects.requireNonNull(resourceType, "resourceType");
    }

    public enum ChangeType {
        CREATE,
        DELETE,
        MODIFY,
        NO_CHANGE,
        IGNORE,
        DEPLOY
    }
}
