package uk.gegc.copilotexport.features.export.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import uk.gegc.copilotexport.features.export.domain.model.ExportFormat;

import java.util.List;

@Schema(name = "TranscriptExportRequest", description = "Whole transcript to export")
public record TranscriptExportRequest(
        @Schema(description = "Messages in display order; may be empty")
        @NotNull(message = "Entries are required")
        List<@Valid @NotNull TranscriptEntryDto> entries,

        @Schema(description = "Base filename; the extension is added when missing", example = "weekly-sync")
        String filename,

        @Schema(description = "DOCUMENT for PDF, TABLE for XLSX", example = "DOCUMENT")
        @NotNull(message = "Export format is required")
        ExportFormat format
) {
}
