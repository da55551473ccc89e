package uk.gegc.copilotexport.features.export.domain.model;

import java.time.Instant;

/**
 * One chat turn as handed over by the chat subsystem.
 * Read-only to the export engine.
 *
 * @param id             opaque unique identifier
 * @param sender         who wrote the message
 * @param content        message text; structured payloads arrive already serialized
 * @param timestamp      when the message was written, may be null
 * @param confidence     assistant confidence in [0,1], may be null
 * @param projectContext project the message refers to, may be null
 */
public record TranscriptEntry(
        String id,
        Sender sender,
        String content,
        Instant timestamp,
        Double confidence,
        String projectContext
) {
    public TranscriptEntry {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Entry id cannot be null or blank");
        }
        if (sender == null) {
            throw new IllegalArgumentException("Entry sender cannot be null");
        }
        if (content == null) {
            content = "";
        }
        if (confidence != null && (confidence.isNaN() || confidence < 0.0 || confidence > 1.0)) {
            throw new IllegalArgumentException("Confidence must be within [0,1] but was " + confidence);
        }
    }

    public static TranscriptEntry user(String id, String content, Instant timestamp) {
        return new TranscriptEntry(id, Sender.USER, content, timestamp, null, null);
    }

    public static TranscriptEntry assistant(String id, String content, Instant timestamp) {
        return new TranscriptEntry(id, Sender.ASSISTANT, content, timestamp, null, null);
    }
}
