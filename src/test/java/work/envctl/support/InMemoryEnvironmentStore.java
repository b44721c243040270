package work.envctl.support;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import work.envctl.config.EnvironmentStore;

public final class InMemoryEnvironmentStore implements EnvironmentStore {
    private final String name;
    public final Map<String, String> values = new LinkedHashMap<>();
    public int saves;

    public InMemoryEnvironmentStore(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void set(String key, String value) {
        values.put(key, value);
    }

    @Override
    public void unset(String key) {
        values.remove(key);
    }

    @Override
    public Map<String, String> values() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public void save() {
        saves++;
    }
}
