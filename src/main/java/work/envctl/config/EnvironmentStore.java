package work.envctl.config;

import java.util.Map;
import java.util.Optional;

/**
 * Flat environment values (deployment outputs, well-known keys). Durable only after {@link #save()}.
 */
public interface EnvironmentStore {

    String name();

    Optional<String> get(String key);

    void set(String key, String value);

    void unset(String key);

    Map<String, String> values();

    void save();
}
