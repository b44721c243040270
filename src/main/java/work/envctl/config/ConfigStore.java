package work.envctl.config;

import java.util.Optional;

/**
 * Persisted per-environment key/value configuration. Keys are dotted paths such as
 * {@code infra.parameters.location}; changes become durable only on {@link #save()}.
 */
public interface ConfigStore {

    Optional<Object> get(String key);

    void set(String key, Object value);

    void unset(String key);

    void save();
}
