package work.envctl.destroy;

import java.util.Objects;
import work.envctl.controlplane.ResourceProperties;
import work.envctl.controlplane.ResourceSummary;

public record PurgeCandidate(
    PurgeKind kind,
    String subscriptionId,
    String resourceGroup,
    ResourceSummary resource,
    ResourceProperties properties
) {
    public PurgeCandidate {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(subscriptionId, "subscriptionId");
        Objects.requireNonNull(resourceGroup, "resourceGroup");
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(properties, "properties");
    }

    /**
     * Soft-deleted resources can be purged unless purge protection forbids it.
     */
    public boolean eligible() {
        return properties.softDeleteEnabled() && !properties.purgeProtectionEnabled();
    }

    /**
     * Label used when grouping candidates for purging; cognitive accounts are split by account kind.
     */
    public String groupLabel() {
        if (kind == PurgeKind.COGNITIVE_ACCOUNT && !properties.kind().isBlank()) {
            return kind.displayName() + " (" + properties.kind() + ")";
        }
        return kind.displayName();
    }
}
