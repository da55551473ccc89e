package uk.gegc.copilotexport.features.speech.domain.model;

/**
 * Error signalled by a speech recognizer.
 *
 * @param code    machine readable code such as {@code not-supported} or {@code no-speech}
 * @param message human readable description
 */
public record SpeechRecognitionError(String code, String message) {

    public static final String NOT_SUPPORTED = "not-supported";

    public SpeechRecognitionError {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Error code cannot be null or blank");
        }
    }
}
