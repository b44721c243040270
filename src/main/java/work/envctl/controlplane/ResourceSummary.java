package work.envctl.controlplane;

import java.util.Objects;

/**
 * A resource found inside a resource group.
 */
public record ResourceSummary(String id, String name, String type, String location) {
    public ResourceSummary {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        location = location == null ? "" : location;
    }
}
