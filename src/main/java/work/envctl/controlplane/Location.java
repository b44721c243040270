package work.envctl.controlplane;

import java.util.Objects;

public record Location(String name, String displayName) {
    public Location {
        Objects.requireNonNull(name, "name");
        displayName = displayName == null || displayName.isBlank() ? name : displayName;
    }
}
