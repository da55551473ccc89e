package uk.gegc.copilotexport.features.export.infra.sink;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.copilotexport.features.export.application.ExportSink;
import uk.gegc.copilotexport.features.export.domain.exception.SaveErrorKind;
import uk.gegc.copilotexport.features.export.domain.model.export.ExportFile;
import uk.gegc.copilotexport.features.export.domain.model.export.SavedExport;
import uk.gegc.copilotexport.shared.result.Result;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps exports in memory. Used as the fallback when the file system is unavailable.
 *
 * <p>The store is bounded by entry count and total bytes; the oldest exports are evicted first.
 * The export just saved is always kept, even when it alone exceeds the byte limit.
 */
@Slf4j
public class InMemoryExportSink implements ExportSink {

    public static final int DEFAULT_MAX_ENTRIES = 20;
    public static final long DEFAULT_MAX_BYTES = 64L * 1024 * 1024;

    private final int maxEntries;
    private final long maxBytes;

    // Insertion order, oldest first
    private final LinkedHashMap<String, StoredExport> exports = new LinkedHashMap<>();
    private long totalBytes;

    public InMemoryExportSink() {
        this(DEFAULT_MAX_ENTRIES, DEFAULT_MAX_BYTES);
    }

    public InMemoryExportSink(int maxEntries, long maxBytes) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be at least 1 but was " + maxEntries);
        }
        if (maxBytes < 1) {
            throw new IllegalArgumentException("maxBytes must be at least 1 but was " + maxBytes);
        }
        this.maxEntries = maxEntries;
        this.maxBytes = maxBytes;
    }

    @Override
    public Result<SavedExport, SaveErrorKind> save(ExportFile file) {
        byte[] bytes;
        try (InputStream in = file.contentSupplier().get()) {
            bytes = in.readAllBytes();
        } catch (IOException | UncheckedIOException e) {
            return Result.failure(SaveErrorKind.WRITE_FAILED, "Failed to read export content: " + e.getMessage());
        }
        store(file.filename(), new StoredExport(file.contentType(), bytes));
        log.debug("Stored export in memory: filename={}, bytes={}", file.filename(), bytes.length);
        return Result.ok(new SavedExport(file.filename(), "memory:" + file.filename(), bytes.length));
    }

    @Override
    public synchronized Optional<ExportFile> open(String filename) {
        return Optional.ofNullable(exports.get(filename))
                .map(stored -> new ExportFile(
                        filename,
                        stored.contentType(),
                        () -> new ByteArrayInputStream(stored.bytes()),
                        stored.bytes().length));
    }

    synchronized int size() {
        return exports.size();
    }

    synchronized long totalBytes() {
        return totalBytes;
    }

    private synchronized void store(String filename, StoredExport export) {
        StoredExport replaced = exports.remove(filename);
        if (replaced != null) {
            totalBytes -= replaced.bytes().length;
        }
        exports.put(filename, export);
        totalBytes += export.bytes().length;

        Iterator<Map.Entry<String, StoredExport>> oldestFirst = exports.entrySet().iterator();
        while ((exports.size() > maxEntries || totalBytes > maxBytes) && exports.size() > 1) {
            Map.Entry<String, StoredExport> oldest = oldestFirst.next();
            totalBytes -= oldest.getValue().bytes().length;
            oldestFirst.remove();
            log.info("Evicted in-memory export: filename={}, bytes={}", oldest.getKey(), oldest.getValue().bytes().length);
        }
    }

    private record StoredExport(String contentType, byte[] bytes) {
    }
}
