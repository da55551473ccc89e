package uk.gegc.copilotexport.features.export.application;

import uk.gegc.copilotexport.features.export.domain.exception.SaveErrorKind;
import uk.gegc.copilotexport.features.export.domain.model.export.ExportFile;
import uk.gegc.copilotexport.features.export.domain.model.export.SavedExport;
import uk.gegc.copilotexport.shared.result.Result;

import java.util.Optional;

/**
 * Save primitive for finished exports. Only complete artifacts are ever handed to a sink.
 */
public interface ExportSink {

    Result<SavedExport, SaveErrorKind> save(ExportFile file);

    /**
     * Looks up a previously saved export by filename.
     */
    Optional<ExportFile> open(String filename);
}
