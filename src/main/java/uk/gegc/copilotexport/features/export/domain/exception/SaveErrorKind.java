package uk.gegc.copilotexport.features.export.domain.exception;

/**
 * Reasons a sink can refuse an export.
 */
public enum SaveErrorKind {
    /**
     * The storage target cannot be reached at all; another sink may still succeed.
     */
    TARGET_UNAVAILABLE,

    /**
     * The target was reachable but writing failed.
     */
    WRITE_FAILED,

    /**
     * The export itself is not acceptable, e.g. an unsafe filename.
     */
    REJECTED
}
