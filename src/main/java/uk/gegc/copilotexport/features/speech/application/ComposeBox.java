package uk.gegc.copilotexport.features.speech.application;

import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;
import uk.gegc.copilotexport.features.speech.domain.model.SpeechRecognitionError;

import java.util.Optional;

/**
 * Draft message state of the chat compose box with optional voice input.
 *
 * <p>Partial speech results replace the draft. Toggling starts listening after a reset, or
 * stops it when already listening. Sending returns the trimmed draft, clears it and resets
 * the recognizer. One instance per conversation, obtained from the context.
 */
@Component
@Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
public class ComposeBox {

    private final SpeechRecognizer recognizer;
    private String draft = "";
    private SpeechRecognitionError lastError;

    public ComposeBox(SpeechRecognizer recognizer) {
        if (recognizer == null) {
            throw new IllegalArgumentException("Recognizer cannot be null");
        }
        this.recognizer = recognizer;
        recognizer.onPartialResult(this::applyPartialResult);
        recognizer.onError(error -> this.lastError = error);
    }

    public synchronized void type(String text) {
        draft = text != null ? text : "";
    }

    public synchronized String draft() {
        return draft;
    }

    public boolean voiceAvailable() {
        return recognizer.isSupported();
    }

    public boolean isListening() {
        return recognizer.isListening();
    }

    public synchronized Optional<SpeechRecognitionError> lastError() {
        return Optional.ofNullable(lastError);
    }

    /**
     * @return {@code true} if listening after the call
     */
    public boolean toggleListening() {
        if (recognizer.isListening()) {
            recognizer.stop();
            return false;
        }
        synchronized (this) {
            lastError = null;
        }
        recognizer.resetState();
        recognizer.start();
        return recognizer.isListening();
    }

    /**
     * @return the message to send, or empty when the draft is blank
     */
    public Optional<String> send() {
        String message;
        synchronized (this) {
            message = draft.trim();
            if (message.isEmpty()) {
                return Optional.empty();
            }
            draft = "";
        }
        if (recognizer.isListening()) {
            recognizer.stop();
        }
        recognizer.resetState();
        return Optional.of(message);
    }

    private synchronized void applyPartialResult(String transcript) {
        if (transcript != null && !transcript.isEmpty()) {
            draft = transcript;
        }
    }
}
