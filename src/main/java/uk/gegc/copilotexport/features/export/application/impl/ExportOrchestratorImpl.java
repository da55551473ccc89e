package uk.gegc.copilotexport.features.export.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.copilotexport.features.export.application.ExportOrchestrator;
import uk.gegc.copilotexport.features.export.application.ExportSink;
import uk.gegc.copilotexport.features.export.application.ExportStateStore;
import uk.gegc.copilotexport.features.export.application.ExportTimestampFormatter;
import uk.gegc.copilotexport.features.export.application.SnapshotSource;
import uk.gegc.copilotexport.features.export.application.export.ExportRenderer;
import uk.gegc.copilotexport.features.export.application.layout.PageComposer;
import uk.gegc.copilotexport.features.export.application.layout.SnapshotSlicer;
import uk.gegc.copilotexport.features.export.application.layout.TextMeasurer;
import uk.gegc.copilotexport.features.export.application.layout.TranscriptPaginator;
import uk.gegc.copilotexport.features.export.application.table.TabularSerializer;
import uk.gegc.copilotexport.features.export.config.ExportProperties;
import uk.gegc.copilotexport.features.export.domain.exception.ExportException;
import uk.gegc.copilotexport.features.export.domain.exception.MeasurementException;
import uk.gegc.copilotexport.features.export.domain.exception.SaveFailedException;
import uk.gegc.copilotexport.features.export.domain.exception.SourceUnavailableException;
import uk.gegc.copilotexport.features.export.domain.model.ExportFormat;
import uk.gegc.copilotexport.features.export.domain.model.Snapshot;
import uk.gegc.copilotexport.features.export.domain.model.TranscriptEntry;
import uk.gegc.copilotexport.features.export.domain.model.export.ExportFile;
import uk.gegc.copilotexport.features.export.domain.model.export.ExportPayload;
import uk.gegc.copilotexport.features.export.domain.model.export.ExportReceipt;
import uk.gegc.copilotexport.features.export.domain.model.export.SavedExport;
import uk.gegc.copilotexport.features.export.domain.model.layout.BlockKind;
import uk.gegc.copilotexport.features.export.domain.model.layout.FontSpec;
import uk.gegc.copilotexport.features.export.domain.model.layout.PageLayout;
import uk.gegc.copilotexport.features.export.domain.model.layout.PaginatedDocument;
import uk.gegc.copilotexport.features.export.domain.model.layout.TextBlock;
import uk.gegc.copilotexport.features.export.infra.ExportMediaTypeResolver;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

@Service
@RequiredArgsConstructor
@Slf4j
public class ExportOrchestratorImpl implements ExportOrchestrator {

    static final String LAST_EXPORT_KEY = "last-export";

    private final TranscriptPaginator transcriptPaginator;
    private final SnapshotSlicer snapshotSlicer;
    private final TabularSerializer tabularSerializer;
    private final List<ExportRenderer> renderers;
    private final ExportSink exportSink;
    private final ExportStateStore stateStore;
    private final ExportMediaTypeResolver mediaTypeResolver;
    private final ExportTimestampFormatter timestampFormatter;
    private final TextMeasurer textMeasurer;
    private final ExportProperties properties;
    private final Clock clock;

    @Override
    public ExportReceipt exportTranscript(List<TranscriptEntry> entries, String filename, ExportFormat format) {
        if (entries == null) {
            throw new IllegalArgumentException("Entries cannot be null");
        }
        if (format == null) {
            throw new IllegalArgumentException("Format cannot be null");
        }
        Instant startTime = clock.instant();
        String resolvedFilename = resolveFilename(filename, properties.getDefaultTranscriptFilename(), format);

        try {
            ExportPayload payload = switch (format) {
                case DOCUMENT -> {
                    PageComposer composer = openDocument(
                            properties.transcriptLayout(), properties.getTranscriptTitle(), startTime);
                    yield ExportPayload.ofDocument(transcriptPaginator.paginate(entries, composer), resolvedFilename);
                }
                case TABLE -> ExportPayload.ofTable(tabularSerializer.serialize(entries), resolvedFilename);
            };
            ExportReceipt receipt = renderAndSave(payload, startTime);

            long durationMs = Duration.between(startTime, clock.instant()).toMillis();
            log.info("Transcript export completed: format={}, entries={}, pages={}, filename={}, exportId={}, durationMs={}",
                    format, entries.size(), receipt.pageCount(), receipt.filename(), receipt.exportId(), durationMs);
            return receipt;
        } catch (ExportException e) {
            log.error("Transcript export failed: kind={}, format={}, filename={}", e.kind(), format, resolvedFilename, e);
            throw e;
        }
    }

    @Override
    public ExportReceipt exportMessage(TranscriptEntry entry, ExportFormat format) {
        if (entry == null) {
            throw new IllegalArgumentException("Entry cannot be null");
        }
        String filename = properties.getMessageFilenamePrefix() + entry.id().replaceAll("[^A-Za-z0-9._-]", "-");
        return exportTranscript(List.of(entry), filename, format);
    }

    @Override
    public CompletableFuture<ExportReceipt> exportSnapshot(SnapshotSource source, String filename) {
        if (source == null) {
            throw new IllegalArgumentException("Snapshot source cannot be null");
        }
        Instant startTime = clock.instant();
        String resolvedFilename = resolveFilename(filename, properties.getDefaultSnapshotFilename(), ExportFormat.DOCUMENT);

        CompletableFuture<Snapshot> capture;
        try {
            capture = source.capture();
            if (capture == null) {
                capture = CompletableFuture.failedFuture(
                        new SourceUnavailableException("Snapshot source " + source.description() + " returned no capture"));
            }
        } catch (RuntimeException e) {
            capture = CompletableFuture.failedFuture(e);
        }

        return capture
                .handle((snapshot, error) -> {
                    if (error != null) {
                        throw sourceUnavailable(source, error);
                    }
                    return snapshot;
                })
                .thenApply(snapshot -> {
                    PageComposer composer = openDocument(
                            properties.snapshotLayout(), properties.getSnapshotTitle(), startTime);
                    PaginatedDocument document = snapshotSlicer.slice(snapshot, composer);
                    return renderAndSave(ExportPayload.ofDocument(document, resolvedFilename), startTime);
                })
                .whenComplete((receipt, error) -> {
                    if (error == null) {
                        long durationMs = Duration.between(startTime, clock.instant()).toMillis();
                        log.info("Snapshot export completed: source={}, pages={}, filename={}, exportId={}, durationMs={}",
                                source.description(), receipt.pageCount(), receipt.filename(), receipt.exportId(), durationMs);
                    } else {
                        Throwable cause = unwrap(error);
                        Object kind = cause instanceof ExportException exportException ? exportException.kind() : "UNEXPECTED";
                        log.error("Snapshot export failed: kind={}, source={}, filename={}",
                                kind, source.description(), resolvedFilename, cause);
                    }
                });
    }

    @Override
    public Optional<ExportReceipt> lastExport() {
        return stateStore.get(LAST_EXPORT_KEY, ExportReceipt.class);
    }

    @Override
    public Optional<ExportFile> openExport(String filename) {
        if (filename == null || filename.isBlank()) {
            return Optional.empty();
        }
        return exportSink.open(filename);
    }

    /**
     * Starts a document with the title and exported-at lines on its first page.
     */
    private PageComposer openDocument(PageLayout layout, String title, Instant exportedAt) {
        float maxWidth = layout.usableWidth();
        if (!(maxWidth > 0f)) {
            throw new MeasurementException("Usable page width must be positive but was " + maxWidth);
        }
        PageComposer composer = new PageComposer(layout);
        ExportProperties.Typography typography = properties.getTypography();
        FontSpec titleFont = FontSpec.bold(typography.getTitleSize());
        FontSpec exportedAtFont = FontSpec.normal(typography.getExportedAtSize());

        List<TextBlock> lines = new ArrayList<>();
        for (String line : textMeasurer.wrap(title, maxWidth, titleFont)) {
            lines.add(new TextBlock(BlockKind.TITLE, line, titleFont, titleFont.size() * typography.getLineSpacing()));
        }
        String exportedOn = "Exported on: " + timestampFormatter.format(exportedAt);
        for (String line : textMeasurer.wrap(exportedOn, maxWidth, exportedAtFont)) {
            lines.add(new TextBlock(BlockKind.EXPORTED_AT, line, exportedAtFont,
                    exportedAtFont.size() * typography.getLineSpacing()));
        }
        lines.forEach(composer::place);
        return composer;
    }

    private ExportReceipt renderAndSave(ExportPayload payload, Instant exportedAt) {
        ExportFile file = resolveRenderer(payload.format()).render(payload);
        SavedExport saved = exportSink.save(file)
                .orElseThrow(failure -> new SaveFailedException(failure.error(), failure.message()));

        ExportReceipt receipt = new ExportReceipt(
                UUID.randomUUID(),
                saved.filename(),
                payload.format(),
                file.contentType(),
                saved.contentLength(),
                payload.pageCount(),
                saved.location(),
                exportedAt
        );
        stateStore.set(LAST_EXPORT_KEY, receipt);
        return receipt;
    }

    private String resolveFilename(String requested, String fallback, ExportFormat format) {
        String base = requested == null || requested.isBlank() ? fallback : requested.trim();
        String extension = "." + mediaTypeResolver.fileExtensionFor(format);
        return base.toLowerCase(Locale.ROOT).endsWith(extension) ? base : base + extension;
    }

    private ExportRenderer resolveRenderer(ExportFormat format) {
        return renderers.stream()
                .filter(r -> r.supports(format))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported export format: " + format));
    }

    private SourceUnavailableException sourceUnavailable(SnapshotSource source, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof SourceUnavailableException unavailable) {
            return unavailable;
        }
        return new SourceUnavailableException("Snapshot capture failed for " + source.description(), cause);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
