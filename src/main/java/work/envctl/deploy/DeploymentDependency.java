package work.envctl.deploy;

import java.util.List;
import java.util.Objects;

/**
 * One entry of a deployment's nested-dependency graph: a resource and the resources it depends on.
 */
public record DeploymentDependency(String resourceType, String resourceName, List<Reference> dependsOn) {
    public DeploymentDependency {
        Objects.requireNonNull(resourceType, "resourceType");
        Objects.requireNonNull(resourceName, "resourceName");
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    public record Reference(String resourceType, String resourceName) {
        public Reference {
            Objects.requireNonNull(resourceType, "resourceType");
            Objects.requireNonNull(resourceName, "resourceName");
        }
    }
}
