package com.capprobe.probe;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON serialization for {@link ProbeReport} and {@link ProbeResult}.
 * <p>
 * Timestamps are written as ISO 8601 strings; {@code reason} and {@code resolution} are omitted
 * for present capabilities.
 */
public final class ProbeReportSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private ProbeReportSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * @throws ProbeReportSerializationException if serialization fails
     */
    public static String serialize(ProbeReport report) {
        try {
            return MAPPER.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new ProbeReportSerializationException("Failed to serialize report of " + report.catalog(), e);
        }
    }

    /**
     * @throws ProbeReportSerializationException if serialization fails
     */
    public static String serialize(ProbeResult result) {
        try {
            return MAPPER.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new ProbeReportSerializationException("Failed to serialize result of " + result.subjectName(), e);
        }
    }

    /**
     * Reads a report written by {@link #serialize(ProbeReport)}.
     *
     * @throws ProbeReportSerializationException if the JSON is malformed or incomplete
     */
    public static ProbeReport deserialize(String json) {
        try {
            return MAPPER.readValue(json, ProbeReport.class);
        } catch (JsonProcessingException e) {
            throw new ProbeReportSerializationException("Failed to deserialize probe report", e);
        }
    }

    /** Returns the shared ObjectMapper. */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    /**
     * Exception thrown when report serialization/deserialization fails.
     */
    public static class ProbeReportSerializationException extends RuntimeException {
        public ProbeReportSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
