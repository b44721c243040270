package work.envctl.destroy;

import java.util.Optional;

/**
 * Helpers for {@code /subscriptions/<id>/resourceGroups/<name>/...} resource identifiers.
 */
public final class ResourceIds {
    private ResourceIds() {}

    public static Optional<String> resourceGroup(String resourceId) {
        if (resourceId == null) {
            return Optional.empty();
        }
        String[] segments = resourceId.split("/");
        for (int i = 0; i < segments.length - 1; i++) {
            if ("resourceGroups".equalsIgnoreCase(segments[i]) && !segments[i + 1].isBlank()) {
                return Optional.of(segments[i + 1]);
            }
        }
        return Optional.empty();
    }

    public static String resourceGroupId(String subscriptionId, String resourceGroup) {
        return "/subscriptions/" + subscriptionId + "/resourceGroups/" + resourceGroup;
    }
}
