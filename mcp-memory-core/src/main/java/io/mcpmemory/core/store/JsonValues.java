package io.mcpmemory.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpmemory.core.model.GlobalConfig;
import io.mcpmemory.core.model.Note;
import java.util.List;
import java.util.Map;

/**
 * JSON round-trips for the opaque parts of the model ({@code metadata}, global values).
 * Values come back in Jackson's natural types: Integer or Long, Double, String, Boolean,
 * List and LinkedHashMap.
 */
public final class JsonValues {
    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public JsonValues(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public JsonValues() {
        this(new ObjectMapper());
    }

    public String write(Object value) throws JsonProcessingException {
        return mapper.writeValueAsString(value);
    }

    public Map<String, Object> readMap(String json) throws JsonProcessingException {
        if (json == null || json.isEmpty()) {
            return null;
        }
        return mapper.readValue(json, MAP);
    }

    public List<String> readTags(String json) throws JsonProcessingException {
        if (json == null || json.isEmpty()) {
            return List.of();
        }
        List<String> tags = mapper.readValue(json, STRINGS);
        return tags == null ? List.of() : List.copyOf(tags);
    }

    public Object readValue(String json) throws JsonProcessingException {
        if (json == null || json.isEmpty()) {
            return null;
        }
        return mapper.readValue(json, Object.class);
    }

    public Object deepCopy(Object value) throws JsonProcessingException {
        if (value == null) {
            return null;
        }
        return mapper.readValue(mapper.writeValueAsString(value), Object.class);
    }

    public Map<String, Object> deepCopyMap(Map<String, Object> value) throws JsonProcessingException {
        if (value == null) {
            return null;
        }
        return mapper.readValue(mapper.writeValueAsString(value), MAP);
    }

    public Note deepCopy(Note note) throws JsonProcessingException {
        return new Note(
            note.id(),
            note.projectId(),
            note.groupId(),
            note.title(),
            note.text(),
            List.copyOf(note.tagsOrEmpty()),
            note.source(),
            note.createdAt(),
            deepCopyMap(note.metadata())
        );
    }

    public GlobalConfig deepCopy(GlobalConfig config) throws JsonProcessingException {
        return new GlobalConfig(config.id(), config.projectId(), config.key(), deepCopy(config.value()), config.updatedAt());
    }
}
