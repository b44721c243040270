package work.envctl.template;

import java.nio.file.Path;

/**
 * Turns an infrastructure module into a deployable {@link Template}.
 */
public interface TemplateCompiler {
    Template compile(Path modulePath);
}
