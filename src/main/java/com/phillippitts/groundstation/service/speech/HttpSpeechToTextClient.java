package com.phillippitts.groundstation.service.speech;

import com.phillippitts.groundstation.config.properties.SpeechServiceProperties;
import com.phillippitts.groundstation.domain.TranscriptionResult;
import com.phillippitts.groundstation.exception.TranscriptionException;
import com.phillippitts.groundstation.service.audio.PcmConverter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Objects;

/**
 * Speech-to-text over HTTP: posts the samples as a multipart file {@code audio.raw} holding
 * float32 little-endian values and expects {@code {"text": ..., "message": ...}} back.
 */
@Component
public class HttpSpeechToTextClient implements SpeechToTextClient {

    private static final Logger LOG = LogManager.getLogger(HttpSpeechToTextClient.class);

    static final String TOKEN_HEADER = "user-token";
    static final String FILE_PART = "file";
    static final String FILE_NAME = "audio.raw";

    private final RestClient restClient;
    private final SpeechServiceProperties properties;

    public HttpSpeechToTextClient(RestClient speechRestClient, SpeechServiceProperties properties) {
        this.restClient = Objects.requireNonNull(speechRestClient, "speechRestClient");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    @Override
    public TranscriptionResult transcribe(float[] samples) {
        MultiValueMap<String, Object> parts = new LinkedMultiValueMap<>();
        parts.add(FILE_PART, new NamedByteArrayResource(PcmConverter.toFloat32LeBytes(samples), FILE_NAME));

        TranscriptionResult result;
        try {
            result = restClient.post()
                    .uri(properties.getTranscriptionUrl())
                    .header(TOKEN_HEADER, properties.getTranscriptionToken())
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(parts)
                    .retrieve()
                    .body(TranscriptionResult.class);
        } catch (RestClientResponseException e) {
            LOG.error("HTTP {} error: {}", e.getStatusCode().value(), e.getResponseBodyAsString());
            throw new TranscriptionException("Speech-to-text request rejected", e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            LOG.error("Network error or timeout after {}: {}", properties.getTimeout(), e.getMessage());
            throw new TranscriptionException("Speech-to-text service unreachable", e);
        } catch (RestClientException e) {
            LOG.error("Response validation error: {}", e.getMessage());
            throw new TranscriptionException("Speech-to-text response failed validation", e);
        }
        if (result == null) {
            throw new TranscriptionException("Speech-to-text service returned an empty body");
        }
        return result;
    }

    /** Multipart requires a file name on the resource. */
    private static final class NamedByteArrayResource extends ByteArrayResource {
        private final String filename;

        NamedByteArrayResource(byte[] bytes, String filename) {
            super(bytes);
            this.filename = filename;
        }

        @Override
        public String getFilename() {
            return filename;
        }

        @Override
        public boolean equals(Object other) {
            return super.equals(other)
                    && other instanceof NamedByteArrayResource named
                    && filename.equals(named.filename);
        }

        @Override
        public int hashCode() {
            return 31 * super.hashCode() + filename.hashCode();
        }
    }
}
