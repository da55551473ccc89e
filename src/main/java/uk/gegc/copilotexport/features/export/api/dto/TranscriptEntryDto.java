package uk.gegc.copilotexport.features.export.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import uk.gegc.copilotexport.features.export.domain.model.Sender;
import uk.gegc.copilotexport.features.export.domain.model.TranscriptEntry;

import java.time.Instant;

/**
 * Transcript entry as sent by the chat front end. Structured content (objects, arrays)
 * is accepted and exported in its JSON form.
 */
@Schema(name = "TranscriptEntry", description = "One chat message to export")
public record TranscriptEntryDto(
        @Schema(description = "Unique message id", example = "msg-42")
        @NotBlank(message = "Entry id must not be blank")
        String id,

        @Schema(description = "Who wrote the message", example = "ASSISTANT")
        @NotNull(message = "Entry sender is required")
        Sender sender,

        @Schema(description = "Message text, or a structured payload exported as JSON")
        JsonNode content,

        @Schema(description = "When the message was written", example = "2024-03-01T10:00:00Z")
        Instant timestamp,

        @Schema(description = "Assistant confidence between 0 and 1", example = "0.87")
        @DecimalMin(value = "0.0", message = "Confidence must be at least 0")
        @DecimalMax(value = "1.0", message = "Confidence must be at most 1")
        Double confidence,

        @Schema(description = "Project the message refers to", example = "Apollo")
        String projectContext
) {
    public TranscriptEntry toDomain() {
        return new TranscriptEntry(id, sender, contentText(), timestamp, confidence, projectContext);
    }

    private String contentText() {
        if (content == null || content.isNull() || content.isMissingNode()) {
            return "";
        }
        return content.isTextual() ? content.asText() : content.toString();
    }
}
