package com.phillippitts.groundstation.presentation.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phillippitts.groundstation.config.properties.SatelliteProperties;
import com.phillippitts.groundstation.domain.ClientRequest;
import com.phillippitts.groundstation.domain.SessionConfig;
import com.phillippitts.groundstation.exception.InvalidTokenException;
import com.phillippitts.groundstation.service.broker.ClientRequestPublisher;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;

/**
 * Text ingestion: lets a device without a microphone send a typed request to the backend.
 * The answer is spoken by the satellites of the room named by {@code device_id}.
 */
@RestController
class TextController {

    private static final Logger LOG = LogManager.getLogger(TextController.class);

    static final String TOKEN_HEADER = "user-token";

    private final ClientRequestPublisher requestPublisher;
    private final byte[] expectedToken;

    TextController(ClientRequestPublisher requestPublisher, SatelliteProperties properties) {
        this.requestPublisher = requestPublisher;
        this.expectedToken = properties.getTextEndpointToken().getBytes(StandardCharsets.UTF_8);
    }

    @PutMapping("/text")
    ResponseEntity<Map<String, Object>> submitText(
            @RequestHeader(value = TOKEN_HEADER, required = false) String token,
            @Valid @RequestBody TextRequest body) {
        if (token == null || !MessageDigest.isEqual(expectedToken, token.getBytes(StandardCharsets.UTF_8))) {
            throw new InvalidTokenException();
        }
        ThreadContext.put("deviceId", body.deviceId());
        ClientRequest request = requestPublisher.publish(
                body.text(), body.deviceId(), SessionConfig.outputTopicFor(body.deviceId()));
        LOG.info("Accepted text request {}", request.id());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                "status", "accepted",
                "request_id", request.id().toString()
        ));
    }

    record TextRequest(
            @NotBlank @JsonProperty("text") String text,
            @NotBlank @JsonProperty("device_id") String deviceId
    ) {
    }
}
