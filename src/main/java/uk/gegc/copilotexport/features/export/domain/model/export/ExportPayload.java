package uk.gegc.copilotexport.features.export.domain.model.export;

import uk.gegc.copilotexport.features.export.domain.model.ExportFormat;
import uk.gegc.copilotexport.features.export.domain.model.layout.PaginatedDocument;
import uk.gegc.copilotexport.features.export.domain.model.table.SpreadsheetTable;

/**
 * A fully built artifact model passed to {@code ExportRenderer} implementations.
 * Exactly one of {@code document} and {@code table} is set, matching {@code format}.
 *
 * @param format   target format
 * @param document laid-out pages for {@link ExportFormat#DOCUMENT}
 * @param table    rows for {@link ExportFormat#TABLE}
 * @param filename final filename including extension
 */
public record ExportPayload(
    ExportFormat format,
    PaginatedDocument document,
    SpreadsheetTable table,
    String filename
) {
    public ExportPayload {
        if (format == null) {
            throw new IllegalArgumentException("Format cannot be null");
        }
        if (format == ExportFormat.DOCUMENT && (document == null || table != null)) {
            throw new IllegalArgumentException("DOCUMENT payload requires a document and no table");
        }
        if (format == ExportFormat.TABLE && (table == null || document != null)) {
            throw new IllegalArgumentException("TABLE payload requires a table and no document");
        }
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("Filename cannot be null or blank");
        }
    }

    public static ExportPayload ofDocument(PaginatedDocument document, String filename) {
        return new ExportPayload(ExportFormat.DOCUMENT, document, null, filename);
    }

    public static ExportPayload ofTable(SpreadsheetTable table, String filename) {
        return new ExportPayload(ExportFormat.TABLE, null, table, filename);
    }

    public int pageCount() {
        return document != null ? document.pageCount() : 0;
    }
}
