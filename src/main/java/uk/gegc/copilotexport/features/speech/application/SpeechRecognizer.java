package uk.gegc.copilotexport.features.speech.application;

import uk.gegc.copilotexport.features.speech.domain.model.SpeechRecognitionError;

import java.util.function.Consumer;

/**
 * Speech-to-text capability feeding plain text into the compose box.
 * Implementations are platform specific; callers check {@link #isSupported()} first.
 */
public interface SpeechRecognizer {

    boolean isSupported();

    boolean isListening();

    void start();

    void stop();

    /**
     * Drops the accumulated transcript so the next session starts empty.
     */
    void resetState();

    /**
     * Registers the listener receiving the transcript recognised so far, replacing any previous one.
     */
    void onPartialResult(Consumer<String> listener);

    void onError(Consumer<SpeechRecognitionError> listener);
}
