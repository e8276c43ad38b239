package ai.pipestream.s3manager.task;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable view of a task at one point in time.
 * The {@link TaskStore} replaces the snapshot atomically on every change, so readers
 * never observe a partial update.
 */
public record TaskSnapshot(
        String id,
        TaskKind kind,
        TaskStatus status,
        int progress,
        String currentStep,
        Map<String, Object> metadata,
        Map<String, Object> result,
        TaskError error,
        Instant createdAt,
        Instant updatedAt,
        boolean cancelRequested) {

    public TaskSnapshot {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(status, "status is required");
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        result = result == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(result));
    }

    public static TaskSnapshot pending(String id, TaskKind kind, Map<String, Object> metadata, Instant now) {
        return new TaskSnapshot(id, kind, TaskStatus.PENDING, 0, "Queued", metadata, null, null, now, now, false);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Creator of the task, as recorded in its metadata */
    public String ownerId() {
        Object owner = metadata.get("user_id");
        return owner != null ? owner.toString() : null;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static final class Builder {
        private final String id;
        private final TaskKind kind;
        private final Map<String, Object> metadata;
        private final Instant createdAt;
        private TaskStatus status;
        private int progress;
        private String currentStep;
        private Map<String, Object> result;
        private TaskError error;
        private Instant updatedAt;
        private boolean cancelRequested;

        private Builder(TaskSnapshot source) {
            this.id = source.id;
            this.kind = source.kind;
            this.metadata = source.metadata;
            this.createdAt = source.createdAt;
            this.status = source.status;
            this.progress = source.progress;
            this.currentStep = source.currentStep;
            this.result = source.result;
            this.error = source.error;
            this.updatedAt = source.updatedAt;
            this.cancelRequested = source.cancelRequested;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder progress(int progress) {
            this.progress = progress;
            return this;
        }

        public Builder currentStep(String currentStep) {
            this.currentStep = currentStep;
            return this;
        }

        public Builder result(Map<String, Object> result) {
            this.result = result;
            return this;
        }

        public Builder error(TaskError error) {
            this.error = error;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder cancelRequested(boolean cancelRequested) {
            this.cancelRequested = cancelRequested;
            return this;
        }

        public TaskSnapshot build() {
            return new TaskSnapshot(id, kind, status, progress, currentStep, metadata, result, error,
                    createdAt, updatedAt, cancelRequested);
        }
    }
}
