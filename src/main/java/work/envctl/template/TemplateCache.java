package work.envctl.template;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Keeps compiled templates for the lifetime of one invocation. Not thread-safe: owned by a single runner.
 */
public final class TemplateCache {
    private final TemplateCompiler compiler;
    private final Map<Path, Template> compiled = new HashMap<>();

    public TemplateCache(TemplateCompiler compiler) {
        this.compiler = Objects.requireNonNull(compiler, "compiler");
    }

    public Template get(Path modulePath) {
        Path key = modulePath.toAbsolutePath().normalize();
        Template cached = compiled.get(key);
        if (cached != null) {
            return cached;
        }
        Template template = compiler.compile(key);
        compiled.put(key, template);
        return template;
    }
}
