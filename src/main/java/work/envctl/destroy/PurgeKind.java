package work.envctl.destroy;

import java.util.Optional;

/**
 * Resource types that stay soft-deleted after their group is removed and need a purge before their names can
 * be reused. Declaration order is purge order.
 */
public enum PurgeKind {
    KEY_VAULT("Microsoft.KeyVault/vaults", "Key Vaults"),
    MANAGED_HSM("Microsoft.KeyVault/managedHSMs", "Managed HSMs"),
    APP_CONFIGURATION("Microsoft.AppConfiguration/configurationStores", "App Configurations"),
    API_MANAGEMENT("Microsoft.ApiManagement/service", "API Managements"),
    COGNITIVE_ACCOUNT("Microsoft.CognitiveServices/accounts", "Cognitive Accounts");

    private final String resourceType;
    private final String displayName;

    PurgeKind(String resourceType, String displayName) {
        this.resourceType = resourceType;
        this.displayName = displayName;
    }

    public String resourceType() {
        return resourceType;
    }

    public String displayName() {
        return displayName;
    }

    public static Optional<PurgeKind> fromResourceType(String type) {
        for (PurgeKind kind : values()) {
            if (kind.resourceType.equalsIgnoreCase(type)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
