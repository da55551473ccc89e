package uk.gegc.copilotexport.features.export.domain.model.layout;

public enum BlockKind {
    TITLE,
    EXPORTED_AT,
    HEADER,
    CONTENT,
    TIMESTAMP,
    IMAGE_SLICE
}
