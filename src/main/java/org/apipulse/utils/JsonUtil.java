package org.apipulse.utils;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.util.Map;

public class JsonUtil {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private JsonUtil() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Reads a JSON object of string values, e.g. headers or credentials columns. Null or blank gives an empty map.
     */
    public static Map<String, String> readStringMap(String json) throws IOException {
        if (json == null || json.isBlank()) return Map.of();
        return MAPPER.readValue(json, new TypeReference<Map<String, String>>() {});
    }

    public static String writeStringMap(Map<String, String> map) throws IOException {
        if (map == null) return null;
        return MAPPER.writeValueAsString(map);
    }
}
