package com.qqsuccubus.beacon.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.qqsuccubus.beacon.core.error.DutyException;

import java.io.UncheckedIOException;

/**
 * JSON codec for REST bodies and WebSocket frames.
 * <p>
 * Reading is lenient about fields it does not know, so clients may send newer payloads; anything it
 * cannot bind fails as {@code INVALID_REQUEST}. Writing a model object is not expected to fail.
 * </p>
 */
public final class JsonUtils {
    private JsonUtils() {
    }

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * @throws DutyException INVALID_REQUEST when {@code json} is malformed or does not bind to {@code type}
     */
    public static <T> T fromJson(String json, Class<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw DutyException.invalidRequest(String.format("Malformed %s: %s",
                    type.getSimpleName(), e.getOriginalMessage()));
        }
    }
}
