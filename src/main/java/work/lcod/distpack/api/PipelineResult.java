package work.lcod.distpack.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Outcome of one {@link DistributionPipeline} stage, usable by the CLI and embedding tools.
 */
public record PipelineResult(
    DistributionPipeline.Stage stage,
    Status status,
    Map<String, Object> metadata,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public PipelineResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static PipelineResult success(DistributionPipeline.Stage stage, Map<String, Object> metadata, Instant startedAt) {
        return new PipelineResult(stage, Status.SUCCESS, metadata, startedAt, Instant.now());
    }

    public static PipelineResult failure(
        DistributionPipeline.Stage stage,
        String code,
        String message,
        Map<String, Object> metadata,
        Instant startedAt
    ) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.put("code", code);
        if (message != null && !message.isBlank()) {
            meta.put("error", message);
        }
        return new PipelineResult(stage, Status.FAILURE, meta, startedAt, Instant.now());
    }

    public boolean succeeded() {
        return status == Status.SUCCESS;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("stage", stage.name().toLowerCase(Locale.ROOT));
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        serializable.put("metadata", metadata);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize pipeline result", ex);
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
