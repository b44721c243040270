package work.envctl.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Outcome of a {@link ProvisionRunner} operation (usable by the CLI and embedding apps).
 */
public record OperationResult(OperationStatus status, Map<String, Object> metadata, Instant startedAt, Instant finishedAt) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public OperationResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static OperationResult success(Map<String, Object> metadata, Instant startedAt) {
        return new OperationResult(OperationStatus.SUCCESS, metadata, startedAt, Instant.now());
    }

    public static OperationResult failure(OperationStatus status, String message, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        if (message != null && !message.isBlank()) {
            meta.putIfAbsent("error", message);
        }
        return new OperationResult(status, meta, startedAt, Instant.now());
    }

    public boolean isSuccess() {
        return status == OperationStatus.SUCCESS;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        serializable.put("metadata", metadata);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }
}
