package uk.gegc.copilotexport.features.export.domain.exception;

public class ExportRenderingException extends ExportException {

    public ExportRenderingException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ExportErrorKind kind() {
        return ExportErrorKind.RENDERING;
    }
}
