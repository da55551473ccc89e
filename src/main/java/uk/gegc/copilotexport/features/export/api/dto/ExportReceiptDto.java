package uk.gegc.copilotexport.features.export.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.copilotexport.features.export.domain.model.ExportFormat;
import uk.gegc.copilotexport.features.export.domain.model.export.ExportReceipt;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "ExportReceipt", description = "Result of a completed export")
public record ExportReceiptDto(
        UUID exportId,
        String filename,
        ExportFormat format,
        String contentType,
        long contentLength,
        @Schema(description = "Number of pages; 0 for tables")
        int pageCount,
        @Schema(description = "Where the export can be downloaded", example = "/api/v1/exports/files/work-buddy-chat.pdf")
        String downloadUrl,
        Instant exportedAt
) {
    public static ExportReceiptDto from(ExportReceipt receipt, String downloadUrl) {
        return new ExportReceiptDto(
                receipt.exportId(),
                receipt.filename(),
                receipt.format(),
                receipt.contentType(),
                receipt.contentLength(),
                receipt.pageCount(),
                downloadUrl,
                receipt.exportedAt()
        );
    }
}
