package uk.gegc.copilotexport.features.export.infra.state;

import org.springframework.stereotype.Component;
import uk.gegc.copilotexport.features.export.application.ExportStateStore;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryExportStateStore implements ExportStateStore {

    private final Map<String, Object> values = new ConcurrentHashMap<>();

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        Object value = values.get(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    @Override
    public void set(String key, Object value) {
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
    }

    @Override
    public void remove(String key) {
        values.remove(key);
    }
}
