package com.delta.requesttimer.schedule.notify;

import com.delta.requesttimer.schedule.util.HashUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Content hashing and sizing of response bodies. Structured bodies are hashed over JSON with
 * object keys sorted at every level; text bodies over their raw text; absent bodies over "".
 */
@Component
public class ResponseHasher {
    private static final Logger log = LoggerFactory.getLogger(ResponseHasher.class);
    private static final String HASH_ERROR_MARKER = "error_calculating_hash";

    private final ObjectMapper objectMapper;
    private final ObjectMapper canonicalMapper;

    public ResponseHasher(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.canonicalMapper = objectMapper.copy().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    public String hash(JsonNode body) {
        try {
            return HashUtils.sha256Hex(canonicalText(body));
        } catch (JsonProcessingException e) {
            log.error("Failed to calculate response hash", e);
            return HashUtils.sha256Hex(HASH_ERROR_MARKER);
        }
    }

    String canonicalText(JsonNode body) throws JsonProcessingException {
        if (body == null || body.isNull() || body.isMissingNode()) {
            return "";
        }
        if (body.isContainerNode()) {
            Object plain = canonicalMapper.treeToValue(body, Object.class);
            return canonicalMapper.writeValueAsString(plain);
        }
        return body.asText();
    }

    /**
     * Bytes the body occupies once serialized: compact JSON for structured bodies, UTF-8 text otherwise.
     */
    public int serializedSize(JsonNode body) {
        if (body == null || body.isNull() || body.isMissingNode()) {
            return 0;
        }
        if (body.isContainerNode()) {
            try {
                return objectMapper.writeValueAsBytes(body).length;
            } catch (JsonProcessingException e) {
                log.warn("Failed to serialize response body for sizing", e);
                return body.toString().getBytes(StandardCharsets.UTF_8).length;
            }
        }
        return body.asText().getBytes(StandardCharsets.UTF_8).length;
    }
}
