package work.envctl.support;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import work.envctl.config.ConfigStore;
import work.envctl.config.ConfigStoreException;

public final class InMemoryConfigStore implements ConfigStore {
    public final Map<String, Object> values = new LinkedHashMap<>();
    public int saves;
    public boolean failOnSave;

    @Override
    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void set(String key, Object value) {
        values.put(key, value);
    }

    @Override
    public void unset(String key) {
        values.remove(key);
    }

    @Override
    public void save() {
        saves++;
        if (failOnSave) {
            throw new ConfigStoreException("disk full", new java.io.IOException("disk full"));
        }
    }
}
