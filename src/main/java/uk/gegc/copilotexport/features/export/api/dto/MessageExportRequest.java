package uk.gegc.copilotexport.features.export.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import uk.gegc.copilotexport.features.export.domain.model.ExportFormat;

@Schema(name = "MessageExportRequest", description = "Single message to export")
public record MessageExportRequest(
        @NotNull(message = "Entry is required")
        @Valid
        TranscriptEntryDto entry,

        @Schema(description = "DOCUMENT for PDF, TABLE for XLSX", example = "TABLE")
        @NotNull(message = "Export format is required")
        ExportFormat format
) {
}
