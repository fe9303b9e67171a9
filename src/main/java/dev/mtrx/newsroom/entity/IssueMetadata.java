package dev.mtrx.newsroom.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Opaque key/value payload attached to a newsletter issue.
 * Stored in PostgreSQL as JSONB: {"editor": "ana", "theme": "markets"}
 */
@Slf4j
public class IssueMetadata {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, String>> MAP_TYPE_REF = new TypeReference<>(){};

    private final Map<String, String> values;

    public IssueMetadata() {
        this.values = new LinkedHashMap<>();
    }

    public IssueMetadata(Map<String, String> values) {
        this.values = values != null ? new LinkedHashMap<>(values) : new LinkedHashMap<>();
    }

    public static IssueMetadata empty() {
        return new IssueMetadata();
    }

    public String get(String key) {
        return values.get(key);
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize issue metadata", e);
            return "{}";
        }
    }

    public static IssueMetadata fromJson(String json) {
        if (json == null || json.isBlank()) {
            return new IssueMetadata();
        }
        try {
            return new IssueMetadata(MAPPER.readValue(json, MAP_TYPE_REF));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable issue metadata, using empty payload: {}", e.getMessage());
            return new IssueMetadata();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IssueMetadata that)) return false;
        return Objects.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "IssueMetadata" + values;
    }
}
