package uk.gegc.copilotexport.features.export.application;

import uk.gegc.copilotexport.features.export.domain.model.ExportFormat;
import uk.gegc.copilotexport.features.export.domain.model.TranscriptEntry;
import uk.gegc.copilotexport.features.export.domain.model.export.ExportFile;
import uk.gegc.copilotexport.features.export.domain.model.export.ExportReceipt;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point of the export engine. Builds the complete artifact, renders it and hands it to the sink.
 * Failures surface as {@link uk.gegc.copilotexport.features.export.domain.exception.ExportException}s.
 */
public interface ExportOrchestrator {

    /**
     * Exports a whole transcript.
     *
     * @param entries  transcript in display order, may be empty
     * @param filename base filename; blank falls back to the configured default, the extension is added when missing
     * @param format   document (PDF) or table (XLSX)
     */
    ExportReceipt exportTranscript(List<TranscriptEntry> entries, String filename, ExportFormat format);

    /**
     * Exports a single message under a filename derived from its id.
     */
    ExportReceipt exportMessage(TranscriptEntry entry, ExportFormat format);

    /**
     * Captures the snapshot source and exports it as a paginated document.
     * The returned future completes exceptionally with an {@code ExportException} on failure.
     */
    CompletableFuture<ExportReceipt> exportSnapshot(SnapshotSource source, String filename);

    Optional<ExportReceipt> lastExport();

    Optional<ExportFile> openExport(String filename);
}
