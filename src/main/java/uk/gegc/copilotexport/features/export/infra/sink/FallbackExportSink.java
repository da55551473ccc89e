package uk.gegc.copilotexport.features.export.infra.sink;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.copilotexport.features.export.application.ExportSink;
import uk.gegc.copilotexport.features.export.domain.exception.SaveErrorKind;
import uk.gegc.copilotexport.features.export.domain.model.export.ExportFile;
import uk.gegc.copilotexport.features.export.domain.model.export.SavedExport;
import uk.gegc.copilotexport.shared.result.Result;

import java.util.Optional;

/**
 * Saves through a primary sink and falls back to a secondary one only when the primary
 * target is unavailable. Write failures and rejections are returned as they are.
 */
@Slf4j
public class FallbackExportSink implements ExportSink {

    private final ExportSink primary;
    private final ExportSink secondary;

    public FallbackExportSink(ExportSink primary, ExportSink secondary) {
        this.primary = primary;
        this.secondary = secondary;
    }

    @Override
    public Result<SavedExport, SaveErrorKind> save(ExportFile file) {
        Result<SavedExport, SaveErrorKind> result = primary.save(file);
        return result.recoverOn(SaveErrorKind.TARGET_UNAVAILABLE, () -> {
            log.warn("Primary export sink unavailable, using fallback: filename={}, reason={}",
                    file.filename(), result.message());
            return secondary.save(file);
        });
    }

    @Override
    public Optional<ExportFile> open(String filename) {
        return primary.open(filename).or(() -> secondary.open(filename));
    }
}
