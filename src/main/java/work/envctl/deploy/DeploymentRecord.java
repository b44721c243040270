package work.envctl.deploy;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One deployment attempt as reported by the control plane. Read-only to envctl.
 */
public record DeploymentRecord(
    String id,
    String name,
    String location,
    ProvisioningState state,
    Instant timestamp,
    Map<String, String> tags,
    String templateHash,
    Map<String, DeploymentOutput> outputs,
    List<String> outputResourceIds,
    List<DeploymentDependency> dependencies
) {
    public DeploymentRecord {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(timestamp, "timestamp");
        tags = tags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
        outputs = outputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        outputResourceIds = outputResourceIds == null ? List.of() : List.copyOf(outputResourceIds);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public Optional<String> tag(String key) {
        return Optional.ofNullable(tags.get(key));
    }

    public Optional<String> templateHashValue() {
        return Optional.ofNullable(templateHash).filter(hash -> !hash.isBlank());
    }
}
