package uk.gegc.copilotexport.features.export.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.InputStreamResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.util.UriComponentsBuilder;
import uk.gegc.copilotexport.features.export.api.dto.ExportReceiptDto;
import uk.gegc.copilotexport.features.export.api.dto.MessageExportRequest;
import uk.gegc.copilotexport.features.export.api.dto.TranscriptEntryDto;
import uk.gegc.copilotexport.features.export.api.dto.TranscriptExportRequest;
import uk.gegc.copilotexport.features.export.application.ExportOrchestrator;
import uk.gegc.copilotexport.features.export.application.SnapshotSource;
import uk.gegc.copilotexport.features.export.domain.exception.SourceUnavailableException;
import uk.gegc.copilotexport.features.export.domain.model.TranscriptEntry;
import uk.gegc.copilotexport.features.export.domain.model.export.ExportFile;
import uk.gegc.copilotexport.features.export.domain.model.export.ExportReceipt;
import uk.gegc.copilotexport.features.export.infra.snapshot.SnapshotSourceFactory;
import uk.gegc.copilotexport.shared.exception.ResourceNotFoundException;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletionException;

@Tag(name = "Exports", description = "Export chat transcripts and dashboard snapshots as PDF or XLSX files.")
@RestController
@RequestMapping("/api/v1/exports")
@RequiredArgsConstructor
@Validated
@Slf4j
public class ExportController {

    private static final String FILES_PATH = "/api/v1/exports/files/{filename}";

    private final ExportOrchestrator exportOrchestrator;
    private final SnapshotSourceFactory snapshotSourceFactory;

    @Operation(
            summary = "Export a chat transcript",
            description = "DOCUMENT produces a paginated A4 PDF with a title page header; TABLE produces a single-sheet XLSX with one row per message."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Export saved"),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "503", description = "Export could not be saved")
    })
    @PostMapping(value = "/transcript", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ExportReceiptDto> exportTranscript(@RequestBody @Valid TranscriptExportRequest request) {
        List<TranscriptEntry> entries = request.entries().stream()
                .map(TranscriptEntryDto::toDomain)
                .toList();
        ExportReceipt receipt = exportOrchestrator.exportTranscript(entries, request.filename(), request.format());
        return created(receipt);
    }

    @Operation(
            summary = "Export a single message",
            description = "Exports one message under the filename work-buddy-message-<id>."
    )
    @PostMapping(value = "/messages", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ExportReceiptDto> exportMessage(@RequestBody @Valid MessageExportRequest request) {
        ExportReceipt receipt = exportOrchestrator.exportMessage(request.entry().toDomain(), request.format());
        return created(receipt);
    }

    @Operation(
            summary = "Export a dashboard snapshot",
            description = "Accepts a rendered dashboard image and exports it as a PDF, sliced into page-sized bands."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Export saved"),
            @ApiResponse(responseCode = "422", description = "Image could not be read")
    })
    @PostMapping(value = "/snapshot", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ExportReceiptDto> exportSnapshot(
            @Parameter(description = "Rendered dashboard image (PNG or JPEG)")
            @RequestParam("image") MultipartFile image,
            @Parameter(description = "Base filename; defaults to insights-dashboard")
            @RequestParam(value = "filename", required = false) String filename
    ) {
        byte[] bytes;
        try {
            bytes = image.getBytes();
        } catch (IOException e) {
            throw new SourceUnavailableException("Uploaded snapshot could not be read", e);
        }
        String description = image.getOriginalFilename() != null ? image.getOriginalFilename() : "upload";
        SnapshotSource source = snapshotSourceFactory.fromImageBytes(bytes, description);

        try {
            ExportReceipt receipt = exportOrchestrator.exportSnapshot(source, filename).join();
            return created(receipt);
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    @Operation(summary = "Download a saved export")
    @GetMapping("/files/{filename}")
    public ResponseEntity<Resource> download(@PathVariable String filename) {
        ExportFile file = exportOrchestrator.openExport(filename)
                .orElseThrow(() -> new ResourceNotFoundException("Export " + filename + " not found"));

        ResponseEntity.BodyBuilder response = ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(file.contentType()))
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(file.filename(), StandardCharsets.UTF_8)
                        .build()
                        .toString());
        if (file.contentLength() >= 0) {
            response.contentLength(file.contentLength());
        }
        return response.body(new InputStreamResource(file.contentSupplier().get()));
    }

    @Operation(summary = "Get the most recent export")
    @GetMapping("/last")
    public ResponseEntity<ExportReceiptDto> lastExport() {
        ExportReceipt receipt = exportOrchestrator.lastExport()
                .orElseThrow(() -> new ResourceNotFoundException("No export has been completed yet"));
        return ResponseEntity.ok(ExportReceiptDto.from(receipt, downloadUrl(receipt).toString()));
    }

    private ResponseEntity<ExportReceiptDto> created(ExportReceipt receipt) {
        URI location = downloadUrl(receipt);
        return ResponseEntity.created(location).body(ExportReceiptDto.from(receipt, location.toString()));
    }

    private URI downloadUrl(ExportReceipt receipt) {
        return UriComponentsBuilder.fromPath(FILES_PATH).build(receipt.filename());
    }
}
