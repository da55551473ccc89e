package uk.gegc.copilotexport.features.export.application.export;

import uk.gegc.copilotexport.features.export.domain.model.ExportFormat;
import uk.gegc.copilotexport.features.export.domain.model.export.ExportFile;
import uk.gegc.copilotexport.features.export.domain.model.export.ExportPayload;

/**
 * SPI for turning a laid-out export model into file bytes.
 */
public interface ExportRenderer {
    boolean supports(ExportFormat format);

    ExportFile render(ExportPayload payload);
}
