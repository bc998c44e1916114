package de.caluga.dataapi.driver.serdes;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import de.caluga.dataapi.driver.DataApiDriverException;
import de.caluga.dataapi.driver.ObjectId;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * JSON codec for request and response bodies. Dates, object ids and uuids use the
 * <code>$date</code>, <code>$objectId</code> and <code>$uuid</code> wrappers on the wire.
 * Numbers are written as JSON numbers; reading big numbers precisely requires a {@link NumericCoercionPolicy}.
 */
public class DataApiJson {
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final ObjectMapper preciseMapper;
    private final ObjectMapper stableMapper;
    private final NumericCoercionPolicy numericCoercionPolicy;

    public DataApiJson() {
        this(null);
    }

    public DataApiJson(NumericCoercionPolicy numericCoercionPolicy) {
        this.numericCoercionPolicy = numericCoercionPolicy;
        mapper = new ObjectMapper().registerModule(wireModule());
        preciseMapper = new ObjectMapper().registerModule(wireModule())
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .enable(DeserializationFeature.USE_BIG_INTEGER_FOR_INTS);
        stableMapper = new ObjectMapper().registerModule(wireModule())
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    public NumericCoercionPolicy getNumericCoercionPolicy() {
        return numericCoercionPolicy;
    }

    public String serialize(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new DataApiDriverException("Could not serialize command: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * serialization with map keys sorted, equal content gives equal strings
     */
    public String stableSerialize(Object value) {
        try {
            return stableMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new DataApiDriverException("Could not serialize value: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * reverse of {@link #serialize(Object)}, the value is treated as a document for the coercion policy
     */
    public Object deserialize(String json) {
        if (json == null || json.isBlank()) return null;
        Object parsed;

        try {
            parsed = (numericCoercionPolicy == null ? mapper : preciseMapper).readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            throw new DataApiDriverException("Could not parse value: " + e.getOriginalMessage(), e);
        }

        Object ret = revive(parsed);
        return numericCoercionPolicy == null ? ret : coerce(ret, new ArrayList<>());
    }

    /**
     * parses a response envelope, revives wrapped values and applies the coercion policy to
     * <code>data.document</code> and <code>data.documents</code>
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> deserializeResponse(String body) {
        if (body == null || body.isBlank()) return new LinkedHashMap<>();
        Map<String, Object> parsed;

        try {
            parsed = (numericCoercionPolicy == null ? mapper : preciseMapper).readValue(body, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new DataApiDriverException("Could not parse response: " + e.getOriginalMessage(), e);
        }

        Map<String, Object> ret = (Map<String, Object>) revive(parsed);

        if (numericCoercionPolicy != null) {
            for (Map.Entry<String, Object> e : ret.entrySet()) {
                if (e.getKey().equals("data") && e.getValue() instanceof Map) {
                    coerceData((Map<String, Object>) e.getValue());
                } else {
                    e.setValue(coerce(e.getValue(), null));
                }
            }
        }

        return ret;
    }

    /**
     * plain JSON value without any coercion, used for DevOps responses.
     * Bodies that are no JSON at all are returned as they are.
     */
    public Object parseOrText(String body) {
        if (body == null || body.isBlank()) return null;

        try {
            return mapper.readValue(body, Object.class);
        } catch (JsonProcessingException e) {
            return body;
        }
    }

    @SuppressWarnings("unchecked")
    private void coerceData(Map<String, Object> data) {
        for (Map.Entry<String, Object> e : data.entrySet()) {
            if (e.getKey().equals("documents") && e.getValue() instanceof List) {
                List<Object> docs = (List<Object>) e.getValue();

                for (int i = 0; i < docs.size(); i++) {
                    docs.set(i, coerce(docs.get(i), new ArrayList<>()));
                }
            } else if (e.getKey().equals("document")) {
                e.setValue(coerce(e.getValue(), new ArrayList<>()));
            } else {
                e.setValue(coerce(e.getValue(), null));
            }
        }
    }

    /**
     * @param path null outside of documents, numbers are then made plain
     */
    @SuppressWarnings("unchecked")
    private Object coerce(Object o, List<String> path) {
        if (o instanceof Map) {
            for (Map.Entry<String, Object> e : ((Map<String, Object>) o).entrySet()) {
                e.setValue(coerce(e.getValue(), child(path, e.getKey())));
            }
            return o;
        }

        if (o instanceof List) {
            List<Object> l = (List<Object>) o;

            for (int i = 0; i < l.size(); i++) {
                l.set(i, coerce(l.get(i), child(path, String.valueOf(i))));
            }
            return l;
        }

        if (o instanceof Number) {
            return numericCoercionPolicy.coerce((Number) o, path == null ? List.of() : path);
        }

        return o;
    }

    private static List<String> child(List<String> path, String key) {
        if (path == null) return null;
        List<String> ret = new ArrayList<>(path);
        ret.add(key);
        return ret;
    }

    /**
     * replaces <code>{$date}</code>, <code>{$objectId}</code> and <code>{$uuid}</code> wrappers by
     * {@link Instant}, {@link ObjectId} and {@link UUID}
     */
    @SuppressWarnings("unchecked")
    public static Object revive(Object o) {
        if (o instanceof Map) {
            Map<String, Object> m = (Map<String, Object>) o;

            if (m.size() == 1) {
                Object v = m.values().iterator().next();

                if (m.containsKey("$date") && v instanceof Number) {
                    return Instant.ofEpochMilli(((Number) v).longValue());
                }

                if (m.containsKey("$objectId") && v instanceof String) {
                    return new ObjectId((String) v);
                }

                if (m.containsKey("$uuid") && v instanceof String) {
                    return UUID.fromString((String) v);
                }
            }

            for (Map.Entry<String, Object> e : m.entrySet()) {
                e.setValue(revive(e.getValue()));
            }

            return m;
        }

        if (o instanceof List) {
            List<Object> l = (List<Object>) o;

            for (int i = 0; i < l.size(); i++) {
                l.set(i, revive(l.get(i)));
            }
        }

        return o;
    }

    private static SimpleModule wireModule() {
        SimpleModule m = new SimpleModule("dataapi-wire");
        m.addSerializer(Date.class, new WrappedSerializer<>(Date.class, "$date") {
            @Override
            void writeValue(Date value, JsonGenerator gen) throws IOException {
                gen.writeNumber(value.getTime());
            }
        });
        m.addSerializer(Instant.class, new WrappedSerializer<>(Instant.class, "$date") {
            @Override
            void writeValue(Instant value, JsonGenerator gen) throws IOException {
                gen.writeNumber(value.toEpochMilli());
            }
        });
        m.addSerializer(ObjectId.class, new WrappedSerializer<>(ObjectId.class, "$objectId") {
            @Override
            void writeValue(ObjectId value, JsonGenerator gen) throws IOException {
                gen.writeString(value.toHexString());
            }
        });
        m.addSerializer(UUID.class, new WrappedSerializer<>(UUID.class, "$uuid") {
            @Override
            void writeValue(UUID value, JsonGenerator gen) throws IOException {
                gen.writeString(value.toString());
            }
        });
        return m;
    }

    private abstract static class WrappedSerializer<T> extends StdSerializer<T> {
        private final String wrapper;

        WrappedSerializer(Class<T> type, String wrapper) {
            super(type);
            this.wrapper = wrapper;
        }

        abstract void writeValue(T value, JsonGenerator gen) throws IOException;

        @Override
        public void serialize(T value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            gen.writeFieldName(wrapper);
            writeValue(value, gen);
            gen.writeEndObject();
        }
    }
}
