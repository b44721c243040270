package work.envctl.project;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.envctl.template.CompileException;

class ProjectManifestLoaderTest {
    @TempDir
    Path tempDir;

    @Test
    void readsAllSections() throws Exception {
        Files.writeString(tempDir.resolve(ProjectManifest.FILE_NAME), """
            name = "todo"

            [infra]
            path = "deploy/bicep"
            parameters = "deploy/dev.parameters.json"

            [environment]
            default = "dev"
            subscription = "0000-sub"
            location = "westeurope"
            resourceGroup = "rg-todo"

            [controlPlane]
            state = "state/cloud"
            """);

        var manifest = ProjectManifestLoader.load(tempDir);

        var root = tempDir.toAbsolutePath().normalize();
        assertEquals("todo", manifest.name());
        assertEquals(root.resolve("deploy/bicep"), manifest.infraModule());
        assertEquals(Optional.of(root.resolve("deploy/dev.parameters.json")), manifest.parameterFile());
        assertEquals(Optional.of("dev"), manifest.defaultEnvironment());
        assertEquals(Optional.of("0000-sub"), manifest.subscriptionId());
        assertEquals(Optional.of("westeurope"), manifest.location());
        assertEquals(Optional.of("rg-todo"), manifest.resourceGroup());
        assertEquals(root.resolve("state/cloud"), manifest.controlPlaneState());
        assertEquals(root.resolve(".envctl").resolve("dev"), manifest.environmentDirectory("dev"));
    }

    @Test
    void appliesConventionalDefaults() throws Exception {
        Files.writeString(tempDir.resolve(ProjectManifest.FILE_NAME), "name = \"todo\"\n");
        Files.createDirectories(tempDir.resolve("infra"));
        Files.writeString(tempDir.resolve("infra").resolve("main.parameters.json"), "{\"parameters\":{}}");

        var manifest = ProjectManifestLoader.load(tempDir);

        var root = tempDir.toAbsolutePath().normalize();
        assertEquals(root.resolve("infra"), manifest.infraModule());
        assertEquals(Optional.of(root.resolve("infra").resolve("main.parameters.json")), manifest.parameterFile());
        assertEquals(root.resolve(".envctl/cloud"), manifest.controlPlaneState());
        assertEquals(Optional.empty(), manifest.subscriptionId());
    }

    @Test
    void missingManifestIsACompileError() {
        assertThrows(CompileException.class, () -> ProjectManifestLoader.load(tempDir));
    }

    @Test
    void invalidTomlIsACompileError() throws Exception {
        Files.writeString(tempDir.resolve(ProjectManifest.FILE_NAME), "name = \n[[");

        assertThrows(CompileException.class, () -> ProjectManifestLoader.load(tempDir));
    }
}
