package uk.gegc.copilotexport.features.export.domain.model.layout;

/**
 * The three text treatments used in exported documents.
 */
public enum FontStyle {
    BOLD,
    NORMAL,
    ITALIC
}
