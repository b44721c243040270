package work.envctl.params;

import java.util.Optional;

/**
 * The location shared by every location-bound parameter of one run. The first location-bound prompt fixes it.
 */
public final class LocationContext {
    private String location;

    public LocationContext() {
        this(null);
    }

    public LocationContext(String initial) {
        this.location = initial == null || initial.isBlank() ? null : initial;
    }

    public Optional<String> location() {
        return Optional.ofNullable(location);
    }

    public boolean isFixed() {
        return location != null;
    }

    public void fix(String value) {
        if (location == null && value != null && !value.isBlank()) {
            location = value;
        }
    }
}
