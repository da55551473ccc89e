package uk.gegc.copilotexport.features.export.domain.exception;

import lombok.Getter;

@Getter
public class SaveFailedException extends ExportException {

    private final SaveErrorKind saveErrorKind;

    public SaveFailedException(SaveErrorKind saveErrorKind, String message) {
        super(message);
        this.saveErrorKind = saveErrorKind;
    }

    @Override
    public ExportErrorKind kind() {
        return ExportErrorKind.SAVE_FAILED;
    }
}
