package uk.gegc.copilotexport.features.export.domain.exception;

/**
 * Raised when a font or width configuration makes text measurement or page layout impossible.
 */
public class MeasurementException extends ExportException {

    public MeasurementException(String message) {
        super(message);
    }

    public MeasurementException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ExportErrorKind kind() {
        return ExportErrorKind.MEASUREMENT;
    }
}
