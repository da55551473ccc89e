package uk.gegc.copilotexport.features.export.domain.model;

/**
 * Author of a transcript entry.
 */
public enum Sender {
    USER,
    ASSISTANT
}
