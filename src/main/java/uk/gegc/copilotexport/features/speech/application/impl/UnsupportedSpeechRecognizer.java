package uk.gegc.copilotexport.features.speech.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;
import uk.gegc.copilotexport.features.speech.application.SpeechRecognizer;
import uk.gegc.copilotexport.features.speech.domain.model.SpeechRecognitionError;

import java.util.function.Consumer;

/**
 * Recognizer for hosts without speech capture, such as this server process.
 * Starting it reports {@code not-supported} through the error listener.
 * Prototype scoped: listeners belong to one compose box.
 */
@Component
@Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
@Slf4j
public class UnsupportedSpeechRecognizer implements SpeechRecognizer {

    private volatile Consumer<SpeechRecognitionError> errorListener = error -> { };

    @Override
    public boolean isSupported() {
        return false;
    }

    @Override
    public boolean isListening() {
        return false;
    }

    @Override
    public void start() {
        log.debug("Speech recognition requested but not supported on this host");
        errorListener.accept(new SpeechRecognitionError(
                SpeechRecognitionError.NOT_SUPPORTED, "Speech recognition is not supported on this host"));
    }

    @Override
    public void stop() {
        // never started
    }

    @Override
    public void resetState() {
        // nothing recorded
    }

    @Override
    public void onPartialResult(Consumer<String> listener) {
        // no results are ever produced
    }

    @Override
    public void onError(Consumer<SpeechRecognitionError> listener) {
        this.errorListener = listener != null ? listener : error -> { };
    }
}
