package com.example.chat.shared.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * JSON helpers for values stored as text columns, such as voice waveforms.
 */
@Slf4j
public final class JsonUtils {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonUtils() {}

    /**
     * Parses a JSON number array, e.g. {@code [0.1,0.42,1.0]}.
     *
     * @return the amplitudes, or an empty list when the column is null, blank or unreadable
     */
    public static List<Double> parseAmplitudes(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<List<Double>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse amplitude array: {}", json, e);
            return List.of();
        }
    }

    public static String toJsonArray(List<Double> amplitudes) {
        if (amplitudes == null || amplitudes.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(amplitudes);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize amplitude array", e);
        }
    }
}
