package com.tollgate.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON serialization of {@link ResponseEnvelope}s. Dates and times, including
 * {@code java.sql.Timestamp} values in result rows, are written as ISO-8601 strings.
 */
public final class EnvelopeSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private EnvelopeSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    /**
     * @throws EnvelopeSerializationException if a result value cannot be written as JSON
     */
    public static String serialize(ResponseEnvelope envelope) {
        try {
            return MAPPER.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new EnvelopeSerializationException("Failed to serialize response envelope", e);
        }
    }

    /** Returns the shared ObjectMapper. */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    public static class EnvelopeSerializationException extends RuntimeException {
        public EnvelopeSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
