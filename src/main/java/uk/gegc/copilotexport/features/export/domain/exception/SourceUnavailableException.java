package uk.gegc.copilotexport.features.export.domain.exception;

public class SourceUnavailableException extends ExportException {

    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ExportErrorKind kind() {
        return ExportErrorKind.SOURCE_UNAVAILABLE;
    }
}
