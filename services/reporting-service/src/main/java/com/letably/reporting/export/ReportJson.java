package com.letably.reporting.export;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.letably.reporting.payload.ReportPayload;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON rendering of report payloads.
 * <p>
 * WHY Jackson: Spring Boot's default JSON library. {@code JavaTimeModule} writes
 * {@code LocalDate} and {@code Instant} as ISO 8601 strings; amounts are written as plain
 * decimals, never in exponent form.
 */
public final class ReportJson {

    private static final ObjectMapper MAPPER = createMapper();

    private ReportJson() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);
    }

    /**
     * Serializes a payload on its own.
     *
     * @throws ReportSerializationException if serialization fails
     */
    public static String toJson(ReportPayload payload) {
        try {
            return MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new ReportSerializationException("Failed to serialize " + payload.reportType().code() + " report", e);
        }
    }

    /**
     * Serializes a payload wrapped with its report code and display name:
     * {@code {"reportType": "arrears", "name": "Arrears Report", "data": {...}}}.
     */
    public static String toEnvelopeJson(ReportPayload payload) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("reportType", payload.reportType().code());
        envelope.put("name", payload.reportType().displayName());
        envelope.put("data", payload);
        try {
            return MAPPER.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new ReportSerializationException("Failed to serialize " + payload.reportType().code() + " report", e);
        }
    }

    /** Returns the shared ObjectMapper. */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    /**
     * Exception thrown when a payload cannot be serialized.
     */
    public static class ReportSerializationException extends RuntimeException {
        public ReportSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
