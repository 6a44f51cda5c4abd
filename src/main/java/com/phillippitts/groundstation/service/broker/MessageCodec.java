package com.phillippitts.groundstation.service.broker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.phillippitts.groundstation.domain.BrokerMessage;
import com.phillippitts.groundstation.domain.ClientRequest;
import com.phillippitts.groundstation.domain.SessionConfig;
import com.phillippitts.groundstation.exception.MessageDecodingException;
import com.phillippitts.groundstation.exception.SessionConfigException;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Encodes and decodes the JSON payloads exchanged with the broker and the satellite handshake.
 *
 * <p>Decoding is strict: payloads must be valid UTF-8, required fields must be present and
 * scalars are not coerced between types. Unknown fields are ignored.
 */
@Component
public class MessageCodec {

    private final ObjectMapper mapper;

    public MessageCodec() {
        this.mapper = JsonMapper.builder()
                .findAndAddModules()
                .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .build();
    }

    /**
     * Decodes raw payload bytes as strict UTF-8.
     *
     * @throws MessageDecodingException if the bytes are not valid UTF-8
     */
    public String decodeText(byte[] payload) {
        if (payload == null) {
            throw new MessageDecodingException("Payload is null");
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(payload))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new MessageDecodingException("Payload is not valid UTF-8", e);
        }
    }

    /**
     * Parses a backend response.
     *
     * @throws MessageDecodingException if the JSON is malformed or {@code text} is missing
     */
    public BrokerMessage decodeBrokerMessage(String json) {
        try {
            BrokerMessage message = mapper.readValue(json, BrokerMessage.class);
            if (message == null) {
                throw new MessageDecodingException("Payload is JSON null");
            }
            return message;
        } catch (JsonProcessingException e) {
            throw new MessageDecodingException("Broker message failed validation: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses the handshake frame a satellite sends right after connecting.
     *
     * @throws SessionConfigException if the JSON is malformed or a field is missing or invalid
     */
    public SessionConfig decodeSessionConfig(String json) {
        try {
            SessionConfig config = mapper.readValue(json, SessionConfig.class);
            if (config == null) {
                throw new SessionConfigException("Session configuration is JSON null");
            }
            return config;
        } catch (JsonProcessingException e) {
            throw new SessionConfigException("Invalid session configuration: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Serializes a request for the backend input topic.
     */
    public String encode(ClientRequest request) {
        try {
            return mapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("ClientRequest is not serializable", e);
        }
    }
}
