package work.envctl.controlplane;

/**
 * Deletion-relevant properties of a resource. {@code kind} is only meaningful for resource types that
 * have sub-kinds (cognitive-service accounts).
 */
public record ResourceProperties(boolean softDeleteEnabled, boolean purgeProtectionEnabled, String location, String kind) {
    public ResourceProperties {
        location = location == null ? "" : location;
        kind = kind == null ? "" : kind;
    }
}
