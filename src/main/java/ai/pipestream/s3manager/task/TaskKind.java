package ai.pipestream.s3manager.task;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The closed set of background task kinds. Each kind is served by exactly one
 * {@link StepFunction}.
 */
public enum TaskKind {
    BUCKET_DELETE("bucket-delete"),
    PREFIX_DELETE("prefix-delete"),
    BULK_DELETE("bulk-delete"),
    CALCULATE_SIZE("calculate-size");

    private final String wireName;

    TaskKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
