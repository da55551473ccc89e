package uk.gegc.copilotexport.features.export.domain.model.export;

import uk.gegc.copilotexport.features.export.domain.model.ExportFormat;

import java.time.Instant;
import java.util.UUID;

/**
 * Completion value of a successful export.
 *
 * @param pageCount number of pages for documents, 0 for tables
 */
public record ExportReceipt(
        UUID exportId,
        String filename,
        ExportFormat format,
        String contentType,
        long contentLength,
        int pageCount,
        String location,
        Instant exportedAt
) {
}
