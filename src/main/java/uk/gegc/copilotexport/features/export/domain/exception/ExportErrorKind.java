package uk.gegc.copilotexport.features.export.domain.exception;

/**
 * Distinguishable failure outcomes of an export.
 */
public enum ExportErrorKind {
    SOURCE_UNAVAILABLE,
    MEASUREMENT,
    RENDERING,
    SAVE_FAILED
}
