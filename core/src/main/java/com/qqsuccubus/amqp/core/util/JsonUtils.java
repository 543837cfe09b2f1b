package com.qqsuccubus.amqp.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;

/**
 * Shared Jackson mapper and helpers for message bodies.
 * <p>
 * The mapper is strict: trailing content after the first JSON value is a decode error.
 * </p>
 */
public final class JsonUtils {
    private JsonUtils() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String writeValueAsString(Object object) {
        try {
            return mapper().writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not JSON serializable", e);
        }
    }

    /**
     * Serializes a value to UTF-8 JSON bytes.
     *
     * @param object value to serialize
     * @return encoded bytes
     * @throws JsonProcessingException if Jackson cannot serialize the value
     */
    public static byte[] writeValueAsBytes(Object object) throws JsonProcessingException {
        return mapper().writeValueAsBytes(object);
    }

    /**
     * Decodes a message body into a JSON tree.
     *
     * @param body raw bytes
     * @return decoded tree, never a missing node
     * @throws JsonDecodeException if the body is empty or not valid JSON
     */
    public static JsonNode readTree(byte[] body) {
        if (body == null || body.length == 0) {
            throw new JsonDecodeException("Syntax error: empty body");
        }
        try {
            JsonNode node = mapper().readTree(body);
            if (node == null || node.isMissingNode()) {
                throw new JsonDecodeException("Syntax error: no JSON content");
            }
            return node;
        } catch (IOException e) {
            throw new JsonDecodeException("Syntax error: " + e.getMessage(), e);
        }
    }
}
