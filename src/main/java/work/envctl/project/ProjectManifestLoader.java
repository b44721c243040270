package work.envctl.project;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import work.envctl.template.CompileException;

/**
 * Reads {@link ProjectManifest} instances from {@code envctl.toml}.
 */
public final class ProjectManifestLoader {
    static final String DEFAULT_INFRA = "infra";
    static final String DEFAULT_STATE = ".envctl/cloud";

    private ProjectManifestLoader() {}

    public static ProjectManifest load(Path projectDirectory) {
        Path directory = projectDirectory.toAbsolutePath().normalize();
        Path manifestPath = directory.resolve(ProjectManifest.FILE_NAME);
        if (!Files.isRegularFile(manifestPath)) {
            throw new CompileException("Project manifest not found: " + manifestPath);
        }
        TomlParseResult result;
        try {
            result = Toml.parse(Files.readString(manifestPath));
        } catch (IOException ex) {
            throw new CompileException("Failed to read project manifest: " + manifestPath, ex);
        }
        if (result.hasErrors()) {
            String errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new CompileException("Invalid project manifest " + manifestPath + ": " + errors);
        }
        return fromToml(directory, result);
    }

    public static ProjectManifest fromToml(Path directory, TomlParseResult result) {
        String name = Optional.ofNullable(result.getString("name"))
            .orElse(directory.getFileName() == null ? "envctl" : directory.getFileName().toString());
        Path infra = directory.resolve(Optional.ofNullable(result.getString("infra.path")).orElse(DEFAULT_INFRA)).normalize();
        Optional<Path> parameters = Optional.ofNullable(result.getString("infra.parameters")).map(directory::resolve);
        if (parameters.isEmpty() && Files.isDirectory(infra)) {
            Path conventional = infra.resolve("main.parameters.json");
            if (Files.isRegularFile(conventional)) {
                parameters = Optional.of(conventional);
            }
        }
        Path state = directory.resolve(Optional.ofNullable(result.getString("controlPlane.state")).orElse(DEFAULT_STATE));
        return new ProjectManifest(
            name,
            directory,
            infra,
            parameters,
            Optional.ofNullable(result.getString("environment.default")),
            Optional.ofNullable(result.getString("environment.subscription")),
            Optional.ofNullable(result.getString("environment.location")),
            Optional.ofNullable(result.getString("environment.resourceGroup")),
            state
        );
    }
}
