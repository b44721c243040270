package work.envctl.project;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Project settings read from {@code envctl.toml}. Relative paths are resolved against the project directory.
 */
public record ProjectManifest(
    String name,
    Path projectDirectory,
    Path infraModule,
    Optional<Path> parameterFile,
    Optional<String> defaultEnvironment,
    Optional<String> subscriptionId,
    Optional<String> location,
    Optional<String> resourceGroup,
    Path controlPlaneState
) {
    public static final String FILE_NAME = "envctl.toml";

    public ProjectManifest {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(projectDirectory, "projectDirectory");
        Objects.requireNonNull(infraModule, "infraModule");
        Objects.requireNonNull(parameterFile, "parameterFile");
        Objects.requireNonNull(defaultEnvironment, "defaultEnvironment");
        Objects.requireNonNull(subscriptionId, "subscriptionId");
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(resourceGroup, "resourceGroup");
        Objects.requireNonNull(controlPlaneState, "controlPlaneState");
    }

    /**
     * Directory holding the stores of one environment.
     */
    public Path environmentDirectory(String environmentName) {
        return projectDirectory.resolve(".envctl").resolve(environmentName);
    }
}
