package uk.gegc.copilotexport.features.export.infra.state;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InMemoryExportStateStore Tests")
class InMemoryExportStateStoreTest {

    private final InMemoryExportStateStore store = new InMemoryExportStateStore();

    @Test
    @DisplayName("get: returns the stored value for the requested type")
    void get_storedValue_present() {
        store.set("last-export", "chat.pdf");

        assertThat(store.get("last-export", String.class)).contains("chat.pdf");
    }

    @Test
    @DisplayName("get: value of another type is treated as absent")
    void get_wrongType_empty() {
        store.set("last-export", 42);

        assertThat(store.get("last-export", String.class)).isEmpty();
    }

    @Test
    @DisplayName("remove and set null: both clear the key")
    void removeAndSetNull_clearKey() {
        store.set("a", "1");
        store.set("b", "2");

        store.remove("a");
        store.set("b", null);

        assertThat(store.get("a", String.class)).isEmpty();
        assertThat(store.get("b", String.class)).isEmpty();
    }
}
