package work.envctl.params;

import java.util.Objects;
import work.envctl.template.ParameterConfigurationException;

/**
 * A {@code "<usage-name>[, <capacity>]"} requirement a location must satisfy. Capacity defaults to 1.
 */
public record QuotaRequirement(String usageName, long capacity) {
    public QuotaRequirement {
        Objects.requireNonNull(usageName, "usageName");
        if (capacity <= 0) {
            throw new ParameterConfigurationException("Quota capacity must be greater than zero for " + usageName);
        }
    }

    public static QuotaRequirement parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ParameterConfigurationException("Quota requirement is empty");
        }
        String[] parts = raw.split(",");
        if (parts.length > 2) {
            throw new ParameterConfigurationException("Invalid quota requirement: " + raw);
        }
        String name = parts[0].trim();
        if (name.isEmpty()) {
            throw new ParameterConfigurationException("Quota requirement is missing a usage name: " + raw);
        }
        if (parts.length == 1 || parts[1].isBlank()) {
            return new QuotaRequirement(name, 1);
        }
        try {
            return new QuotaRequirement(name, Long.parseLong(parts[1].trim()));
        } catch (NumberFormatException ex) {
            throw new ParameterConfigurationException("Invalid quota capacity in: " + raw);
        }
    }
}
