package uk.gegc.copilotexport.features.export.application;

import java.util.Optional;

/**
 * Key-value store for state kept between exports, such as the last export receipt.
 */
public interface ExportStateStore {

    <T> Optional<T> get(String key, Class<T> type);

    void set(String key, Object value);

    void remove(String key);
}
