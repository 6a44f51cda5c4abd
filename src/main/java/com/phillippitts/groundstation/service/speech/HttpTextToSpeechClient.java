package com.phillippitts.groundstation.service.speech;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phillippitts.groundstation.config.properties.SpeechServiceProperties;
import com.phillippitts.groundstation.exception.SynthesisException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Objects;

/**
 * Text-to-speech over HTTP: posts {@code {"text": ..., "sample_rate": ...}} and returns the
 * response body as raw audio.
 */
@Component
public class HttpTextToSpeechClient implements TextToSpeechClient {

    private static final Logger LOG = LogManager.getLogger(HttpTextToSpeechClient.class);

    /** Smallest body treated as audio: one 16-bit sample. */
    public static final int MIN_AUDIO_BYTES = 2;

    private final RestClient restClient;
    private final SpeechServiceProperties properties;

    public HttpTextToSpeechClient(RestClient speechRestClient, SpeechServiceProperties properties) {
        this.restClient = Objects.requireNonNull(speechRestClient, "speechRestClient");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    @Override
    public byte[] synthesize(String text, int sampleRate) {
        byte[] audio;
        try {
            audio = restClient.post()
                    .uri(properties.getSynthesisUrl())
                    .header(HttpSpeechToTextClient.TOKEN_HEADER, properties.getSynthesisToken())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new SynthesisRequest(text, sampleRate))
                    .retrieve()
                    .body(byte[].class);
        } catch (RestClientResponseException e) {
            LOG.error("HTTP {} error: {}", e.getStatusCode().value(), e.getResponseBodyAsString());
            throw new SynthesisException("Text-to-speech request rejected with status " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            LOG.error("Network error or timeout after {}: {}", properties.getTimeout(), e.getMessage());
            throw new SynthesisException("Text-to-speech service unreachable", e);
        } catch (RestClientException e) {
            throw new SynthesisException("Text-to-speech call failed", e);
        }
        if (audio == null || audio.length < MIN_AUDIO_BYTES) {
            int size = audio == null ? 0 : audio.length;
            LOG.error("Insufficient audio data: {} bytes", size);
            throw new SynthesisException("Insufficient audio data: " + size + " bytes");
        }
        return audio;
    }

    record SynthesisRequest(
            @JsonProperty("text") String text,
            @JsonProperty("sample_rate") int sampleRate
    ) {
    }
}
