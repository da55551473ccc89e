package uk.gegc.copilotexport.features.export.infra;

import org.springframework.stereotype.Component;
import uk.gegc.copilotexport.features.export.domain.model.ExportFormat;

import java.util.Locale;

@Component
public class ExportMediaTypeResolver {

    public static final String PDF = "application/pdf";
    public static final String XLSX = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";
    private static final String OCTET_STREAM = "application/octet-stream";

    public String fileExtensionFor(ExportFormat format) {
        return switch (format) {
            case DOCUMENT -> "pdf";
            case TABLE -> "xlsx";
        };
    }

    public String contentTypeForFilename(String filename) {
        String lower = filename.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".pdf")) {
            return PDF;
        }
        if (lower.endsWith(".xlsx")) {
            return XLSX;
        }
        return OCTET_STREAM;
    }
}
