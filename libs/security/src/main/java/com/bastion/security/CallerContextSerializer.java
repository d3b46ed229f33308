package com.bastion.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Base64;

/**
 * Serializes and deserializes {@link CallerContext} for propagation in gRPC metadata.
 * <p>
 * Metadata values are strings, so the context travels as Base64-encoded JSON.
 */
public final class CallerContextSerializer {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private CallerContextSerializer() {
        // utility class
    }

    /**
     * Serializes a caller context to a Base64-encoded JSON string.
     *
     * @throws SecuritySerializationException if serialization fails
     */
    public static String serialize(CallerContext context) {
        try {
            byte[] json = MAPPER.writeValueAsBytes(context);
            return Base64.getEncoder().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new SecuritySerializationException("Failed to serialize caller context", e);
        }
    }

    /**
     * Deserializes a Base64-encoded JSON string back to a caller context.
     *
     * @throws SecuritySerializationException if the value is not valid Base64 or JSON
     */
    public static CallerContext deserialize(String encoded) {
        try {
            byte[] json = Base64.getDecoder().decode(encoded);
            return MAPPER.readValue(json, CallerContext.class);
        } catch (Exception e) {
            throw new SecuritySerializationException("Failed to deserialize caller context", e);
        }
    }

    /**
     * Exception thrown when caller context serialization/deserialization fails.
     */
    public static class SecuritySerializationException extends RuntimeException {
        public SecuritySerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
