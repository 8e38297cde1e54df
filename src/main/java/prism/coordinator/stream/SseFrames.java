package prism.coordinator.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import prism.coordinator.model.JobUpdate;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Encodes progress events as {@code text/event-stream} frames.
 */
public final class SseFrames {

    private final ObjectMapper mapper;

    public SseFrames(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String connected() {
        return data(mapper.createObjectNode().put("type", "connected"));
    }

    public String heartbeat() {
        return data(mapper.createObjectNode().put("type", "heartbeat"));
    }

    public String error(String message) {
        return data(mapper.createObjectNode()
                .put("type", "error")
                .put("message", message != null ? message : "stream error"));
    }

    /**
     * Update frame; carries an {@code id:} line with the event timestamp so
     * a reconnecting client can resume after it.
     */
    public String update(JobUpdate update, String deviceSerial) {
        ObjectNode node = mapper.createObjectNode()
                .put("device_id", update.deviceId())
                .put("device_serial", deviceSerial != null ? deviceSerial : update.deviceId())
                .put("status", update.status())
                .put("message", update.message() != null ? update.message() : "")
                .put("timestamp", update.timestamp().toString());
        if (update.traceId() != null) {
            node.put("trace_id", update.traceId());
        }
        return "id: " + update.timestamp() + "\n" + data(node);
    }

    private String data(ObjectNode node) {
        try {
            return "data: " + mapper.writeValueAsString(node) + "\n\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode event frame", e);
        }
    }

    /**
     * Parse a resume position from {@code ?since=} or {@code Last-Event-ID}.
     *
     * @return null when absent
     * @throws IllegalArgumentException if the value is not an ISO-8601 instant
     */
    public static Instant parseResumePoint(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid resume timestamp: " + value);
        }
    }
}
