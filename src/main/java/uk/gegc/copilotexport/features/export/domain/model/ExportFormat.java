package uk.gegc.copilotexport.features.export.domain.model;

/**
 * Enumeration of supported export formats.
 */
public enum ExportFormat {
    /**
     * Paginated A4 PDF document
     */
    DOCUMENT,

    /**
     * Single-sheet XLSX table, one row per transcript entry
     */
    TABLE
}
