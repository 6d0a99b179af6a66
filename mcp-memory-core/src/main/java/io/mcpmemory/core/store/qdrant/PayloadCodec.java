package io.mcpmemory.core.store.qdrant;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.mcpmemory.core.model.GlobalConfig;
import io.mcpmemory.core.model.Group;
import io.mcpmemory.core.model.Note;
import io.mcpmemory.core.store.JsonValues;
import io.mcpmemory.core.store.Timestamps;
import io.qdrant.client.grpc.JsonWithInt.ListValue;
import io.qdrant.client.grpc.JsonWithInt.NullValue;
import io.qdrant.client.grpc.JsonWithInt.Struct;
import io.qdrant.client.grpc.JsonWithInt.Value;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts model objects to Qdrant payloads and back. Opaque values are first normalized
 * through Jackson so that any JSON-representable value survives the round trip with the
 * same Java types the SQL backend produces.
 */
final class PayloadCodec {
    static final String ID = "id";
    static final String PROJECT_ID = "projectId";
    static final String GROUP_ID = "groupId";
    static final String TITLE = "title";
    static final String TEXT = "text";
    static final String TAGS = "tags";
    static final String SOURCE = "source";
    static final String CREATED_AT = "createdAt";
    static final String CREATED_AT_TIMESTAMP = "createdAtTimestamp";
    static final String METADATA = "metadata";
    static final String KEY = "key";
    static final String VALUE = "value";
    static final String UPDATED_AT = "updatedAt";
    static final String GROUP_KEY = "groupKey";
    static final String DESCRIPTION = "description";
    static final String TYPE = "type";

    static final String TYPE_GLOBAL_CONFIG = "global_config";
    static final String TYPE_GROUP = "group";

    private final JsonValues json;

    PayloadCodec(JsonValues json) {
        this.json = json;
    }

    Map<String, Value> encodeNote(Note note) throws JsonProcessingException {
        Map<String, Value> payload = new HashMap<>();
        payload.put(ID, string(note.id()));
        payload.put(PROJECT_ID, string(note.projectId()));
        payload.put(GROUP_ID, string(note.groupId()));
        payload.put(TEXT, string(note.text()));
        putIfPresent(payload, TITLE, note.title());
        putIfPresent(payload, SOURCE, note.source());
        if (note.createdAt() != null) {
            payload.put(CREATED_AT, string(note.createdAt()));
            Timestamps.parse(note.createdAt())
                .ifPresent(at -> payload.put(CREATED_AT_TIMESTAMP, number(epochSeconds(at))));
        }
        payload.put(TAGS, toValue(note.tagsOrEmpty()));
        if (note.metadata() != null) {
            payload.put(METADATA, toValue(json.deepCopyMap(note.metadata())));
        }
        return payload;
    }

    @SuppressWarnings("unchecked")
    Note decodeNote(Map<String, Value> payload) {
        Object metadata = payload.containsKey(METADATA) ? toJava(payload.get(METADATA)) : null;
        return new Note(
            stringOrNull(payload, ID),
            stringOrNull(payload, PROJECT_ID),
            stringOrNull(payload, GROUP_ID),
            stringOrNull(payload, TITLE),
            stringOrNull(payload, TEXT),
            decodeTags(payload.get(TAGS)),
            stringOrNull(payload, SOURCE),
            stringOrNull(payload, CREATED_AT),
            metadata instanceof Map<?, ?> map ? (Map<String, Object>) map : null
        );
    }

    Map<String, Value> encodeGlobal(GlobalConfig config) throws JsonProcessingException {
        Map<String, Value> payload = new HashMap<>();
        payload.put(ID, string(config.id()));
        payload.put(PROJECT_ID, string(config.projectId()));
        payload.put(KEY, string(config.key()));
        payload.put(VALUE, toValue(json.deepCopy(config.value())));
        putIfPresent(payload, UPDATED_AT, config.updatedAt());
        payload.put(TYPE, string(TYPE_GLOBAL_CONFIG));
        return payload;
    }

    GlobalConfig decodeGlobal(Map<String, Value> payload) {
        return new GlobalConfig(
            stringOrNull(payload, ID),
            stringOrNull(payload, PROJECT_ID),
            stringOrNull(payload, KEY),
            payload.containsKey(VALUE) ? toJava(payload.get(VALUE)) : null,
            stringOrNull(payload, UPDATED_AT)
        );
    }

    Map<String, Value> encodeGroup(Group group) {
        Map<String, Value> payload = new HashMap<>();
        payload.put(ID, string(group.id()));
        payload.put(PROJECT_ID, string(group.projectId()));
        payload.put(GROUP_KEY, string(group.groupKey()));
        payload.put(TITLE, string(group.title()));
        putIfPresent(payload, DESCRIPTION, group.description());
        putIfPresent(payload, CREATED_AT, group.createdAt() == null ? null : group.createdAt().toString());
        putIfPresent(payload, UPDATED_AT, group.updatedAt() == null ? null : group.updatedAt().toString());
        payload.put(TYPE, string(TYPE_GROUP));
        return payload;
    }

    Group decodeGroup(Map<String, Value> payload) {
        String createdAt = stringOrNull(payload, CREATED_AT);
        String updatedAt = stringOrNull(payload, UPDATED_AT);
        return new Group(
            stringOrNull(payload, ID),
            stringOrNull(payload, PROJECT_ID),
            stringOrNull(payload, GROUP_KEY),
            stringOrNull(payload, TITLE),
            stringOrNull(payload, DESCRIPTION),
            createdAt == null ? null : Instant.parse(createdAt),
            updatedAt == null ? null : Instant.parse(updatedAt)
        );
    }

    static double epochSeconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0;
    }

    static String stringOrNull(Map<String, Value> payload, String field) {
        Value value = payload.get(field);
        if (value == null || value.getKindCase() != Value.KindCase.STRING_VALUE) {
            return null;
        }
        return value.getStringValue();
    }

    static Value toValue(Object value) {
        if (value == null) {
            return Value.newBuilder().setNullValue(NullValue.NULL_VALUE).build();
        }
        if (value instanceof String text) {
            return string(text);
        }
        if (value instanceof Boolean flag) {
            return Value.newBuilder().setBoolValue(flag).build();
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return Value.newBuilder().setIntegerValue(((Number) value).longValue()).build();
        }
        if (value instanceof BigInteger big && big.bitLength() < Long.SIZE) {
            return Value.newBuilder().setIntegerValue(big.longValue()).build();
        }
        if (value instanceof Number number) {
            return number(number.doubleValue());
        }
        if (value instanceof Map<?, ?> map) {
            Struct.Builder struct = Struct.newBuilder();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                struct.putFields(String.valueOf(entry.getKey()), toValue(entry.getValue()));
            }
            return Value.newBuilder().setStructValue(struct).build();
        }
        if (value instanceof Collection<?> items) {
            ListValue.Builder list = ListValue.newBuilder();
            for (Object item : items) {
                list.addValues(toValue(item));
            }
            return Value.newBuilder().setListValue(list).build();
        }
        throw new IllegalArgumentException("unsupported payload value type " + value.getClass().getName());
    }

    /**
     * Integers narrow to {@link Integer} when they fit, matching how Jackson reads JSON.
     */
    static Object toJava(Value value) {
        if (value == null) {
            return null;
        }
        switch (value.getKindCase()) {
            case STRING_VALUE:
                return value.getStringValue();
            case BOOL_VALUE:
                return value.getBoolValue();
            case INTEGER_VALUE:
                long integer = value.getIntegerValue();
                if (integer >= Integer.MIN_VALUE && integer <= Integer.MAX_VALUE) {
                    return (int) integer;
                }
                return integer;
            case DOUBLE_VALUE:
                return value.getDoubleValue();
            case STRUCT_VALUE:
                Map<String, Object> map = new LinkedHashMap<>();
                for (Map.Entry<String, Value> entry : value.getStructValue().getFieldsMap().entrySet()) {
                    map.put(entry.getKey(), toJava(entry.getValue()));
                }
                return map;
            case LIST_VALUE:
                List<Object> list = new ArrayList<>();
                for (Value item : value.getListValue().getValuesList()) {
                    list.add(toJava(item));
                }
                return list;
            default:
                return null;
        }
    }

    private static List<String> decodeTags(Value value) {
        if (value == null || value.getKindCase() != Value.KindCase.LIST_VALUE) {
            return List.of();
        }
        List<String> tags = new ArrayList<>();
        for (Value item : value.getListValue().getValuesList()) {
            if (item.getKindCase() == Value.KindCase.STRING_VALUE) {
                tags.add(item.getStringValue());
            }
        }
        return List.copyOf(tags);
    }

    private static void putIfPresent(Map<String, Value> payload, String field, String value) {
        if (value != null) {
            payload.put(field, string(value));
        }
    }

    private static Value string(String value) {
        return Value.newBuilder().setStringValue(value).build();
    }

    private static Value number(double value) {
        return Value.newBuilder().setDoubleValue(value).build();
    }
}
