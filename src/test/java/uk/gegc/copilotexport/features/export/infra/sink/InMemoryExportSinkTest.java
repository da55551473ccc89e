package uk.gegc.copilotexport.features.export.infra.sink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.copilotexport.features.export.domain.exception.SaveErrorKind;
import uk.gegc.copilotexport.features.export.domain.model.export.ExportFile;
import uk.gegc.copilotexport.features.export.domain.model.export.SavedExport;
import uk.gegc.copilotexport.shared.result.Result;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InMemoryExportSink Tests")
class InMemoryExportSinkTest {

    @Test
    @DisplayName("save then open: content can be read repeatedly")
    void saveThenOpen_contentReadable() throws IOException {
        InMemoryExportSink sink = new InMemoryExportSink();
        byte[] content = "hello".getBytes(StandardCharsets.UTF_8);

        Result<SavedExport, SaveErrorKind> result = sink.save(
                new ExportFile("chat.pdf", "application/pdf", () -> new ByteArrayInputStream(content), -1));

        assertThat(result.value().location()).isEqualTo("memory:chat.pdf");
        assertThat(result.value().contentLength()).isEqualTo(5);
        ExportFile opened = sink.open("chat.pdf").orElseThrow();
        for (int i = 0; i < 2; i++) {
            try (InputStream in = opened.contentSupplier().get()) {
                assertThat(in.readAllBytes()).isEqualTo(content);
            }
        }
    }

    @Test
    @DisplayName("save: unreadable content is a write failure")
    void save_unreadableContent_writeFailed() {
        InMemoryExportSink sink = new InMemoryExportSink();

        Result<SavedExport, SaveErrorKind> result = sink.save(new ExportFile("chat.pdf", "application/pdf",
                () -> new InputStream() {
                    @Override
                    public int read() throws IOException {
                        throw new IOException("broken");
                    }
                }, 1));

        assertThat(result.error()).isEqualTo(SaveErrorKind.WRITE_FAILED);
        assertThat(sink.open("chat.pdf")).isEmpty();
    }

    @Test
    @DisplayName("open: unknown name is empty")
    void open_unknown_empty() {
        assertThat(new InMemoryExportSink().open("missing.pdf")).isEmpty();
    }

    @Test
    @DisplayName("save: oldest export is evicted once the entry limit is exceeded")
    void save_overEntryLimit_evictsOldest() {
        // Given
        InMemoryExportSink sink = new InMemoryExportSink(2, 1_000);

        // When
        sink.save(file("a.pdf", 10));
        sink.save(file("b.pdf", 10));
        sink.save(file("c.pdf", 10));

        // Then
        assertThat(sink.open("a.pdf")).isEmpty();
        assertThat(sink.open("b.pdf")).isPresent();
        assertThat(sink.open("c.pdf")).isPresent();
        assertThat(sink.size()).isEqualTo(2);
        assertThat(sink.totalBytes()).isEqualTo(20);
    }

    @Test
    @DisplayName("save: oldest exports are evicted until the byte limit holds")
    void save_overByteLimit_evictsOldestUntilWithinLimit() {
        InMemoryExportSink sink = new InMemoryExportSink(10, 100);
        sink.save(file("a.pdf", 40));
        sink.save(file("b.pdf", 40));

        sink.save(file("c.pdf", 50));

        assertThat(sink.open("a.pdf")).isEmpty();
        assertThat(sink.open("b.pdf")).isPresent();
        assertThat(sink.totalBytes()).isEqualTo(90);
    }

    @Test
    @DisplayName("save: an export larger than the byte limit is still kept on its own")
    void save_singleOversizedExport_keptAlone() {
        InMemoryExportSink sink = new InMemoryExportSink(10, 100);
        sink.save(file("a.pdf", 40));

        Result<SavedExport, SaveErrorKind> result = sink.save(file("big.pdf", 500));

        assertThat(result.isOk()).isTrue();
        assertThat(sink.open("a.pdf")).isEmpty();
        assertThat(sink.open("big.pdf")).isPresent();
        assertThat(sink.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("save: saving the same name again replaces it and refreshes its age")
    void save_sameName_replacesAndRefreshes() {
        InMemoryExportSink sink = new InMemoryExportSink(2, 1_000);
        sink.save(file("a.pdf", 10));
        sink.save(file("b.pdf", 10));

        sink.save(file("a.pdf", 30));
        sink.save(file("c.pdf", 10));

        assertThat(sink.open("b.pdf")).isEmpty();
        assertThat(sink.open("a.pdf")).hasValueSatisfying(f -> assertThat(f.contentLength()).isEqualTo(30));
        assertThat(sink.totalBytes()).isEqualTo(40);
    }

    @Test
    @DisplayName("constructor: limits must be positive")
    void constructor_nonPositiveLimits_rejected() {
        assertThatThrownBy(() -> new InMemoryExportSink(0, 100)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InMemoryExportSink(1, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    private static ExportFile file(String filename, int size) {
        byte[] content = new byte[size];
        return new ExportFile(filename, "application/pdf", () -> new ByteArrayInputStream(content), size);
    }
}
