package com.theset.setlist.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.theset.setlist.domain.model.Track;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Jackson mapping for the JSONB columns.
 */
@Component
public class JsonColumns {

    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {};
    private static final TypeReference<List<Track>> TRACKS = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public JsonColumns(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize JSON column", e);
        }
    }

    public List<String> readStrings(String json) {
        List<String> values = read(json, STRINGS);
        return values == null ? List.of() : values;
    }

    /**
     * @return null when the column is NULL, so an absent snapshot stays distinguishable from an empty one
     */
    public List<Track> readTracks(String json) {
        return read(json, TRACKS);
    }

    private <T> T read(String json, TypeReference<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new DataRetrievalFailureException("Corrupt JSON column", e);
        }
    }
}
