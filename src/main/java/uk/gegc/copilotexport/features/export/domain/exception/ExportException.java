package uk.gegc.copilotexport.features.export.domain.exception;

/**
 * Base class for every failure that aborts an export.
 */
public abstract class ExportException extends RuntimeException {

    protected ExportException(String message) {
        super(message);
    }

    protected ExportException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ExportErrorKind kind();
}
