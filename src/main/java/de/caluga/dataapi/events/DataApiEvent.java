package de.caluga.dataapi.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * base of all emitted events. Listeners may stop the event from bubbling up the emitter hierarchy.
 */
public abstract class DataApiEvent {
    private static final DateTimeFormatter TS_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss'Z'").withZone(ZoneOffset.UTC);
    private static final ObjectMapper verboseMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final String name;
    private final String requestId;
    private final Instant timestamp = Instant.now();
    private PropagationState propagationState = PropagationState.CONTINUE;

    protected DataApiEvent(String name, String requestId) {
        this.name = name;
        this.requestId = requestId;
    }

    public String getName() {
        return name;
    }

    public String getRequestId() {
        return requestId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public abstract DataApiEventType getType();

    /**
     * listeners registered on the current emitter still run, parents are not notified
     */
    public void stopPropagation() {
        if (propagationState == PropagationState.CONTINUE) {
            propagationState = PropagationState.STOP;
        }
    }

    /**
     * no other listener is called at all
     */
    public void stopImmediatePropagation() {
        propagationState = PropagationState.STOP_IMMEDIATE;
    }

    public PropagationState getPropagationState() {
        return propagationState;
    }

    public String format() {
        return TS_FORMAT.format(timestamp) + " [" + name + "]: " + describe();
    }

    public String formatVerbose() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("name", name);
        fields.put("requestId", requestId);
        addFields(fields);

        try {
            return format() + "\n" + verboseMapper.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            return format() + "\n" + fields;
        }
    }

    /**
     * short human readable part of {@link #format()}
     */
    protected abstract String describe();

    protected abstract void addFields(Map<String, Object> fields);

    public enum PropagationState {
        CONTINUE, STOP, STOP_IMMEDIATE,
    }
}
