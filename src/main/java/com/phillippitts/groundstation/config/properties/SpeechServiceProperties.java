package com.phillippitts.groundstation.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the external speech-to-text and text-to-speech HTTP services.
 */
@Validated
@ConfigurationProperties(prefix = "groundstation.speech")
public class SpeechServiceProperties {

    @NotBlank
    private final String transcriptionUrl;

    private final String transcriptionToken;

    @NotBlank
    private final String synthesisUrl;

    private final String synthesisToken;

    /** Request timeout applied to both services. */
    @NotNull
    private final Duration timeout;

    @ConstructorBinding
    public SpeechServiceProperties(String transcriptionUrl,
                                   String transcriptionToken,
                                   String synthesisUrl,
                                   String synthesisToken,
                                   Duration timeout) {
        this.transcriptionUrl = transcriptionUrl == null
                ? "http://localhost:8000/transcribe" : transcriptionUrl;
        this.transcriptionToken = transcriptionToken == null ? "" : transcriptionToken;
        this.synthesisUrl = synthesisUrl == null
                ? "http://localhost:8080/synthesizeSpeech" : synthesisUrl;
        this.synthesisToken = synthesisToken == null ? "" : synthesisToken;
        this.timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
    }

    public String getTranscriptionUrl() {
        return transcriptionUrl;
    }

    public String getTranscriptionToken() {
        return transcriptionToken;
    }

    public String getSynthesisUrl() {
        return synthesisUrl;
    }

    public String getSynthesisToken() {
        return synthesisToken;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
