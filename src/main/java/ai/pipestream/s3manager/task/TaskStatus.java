package ai.pipestream.s3manager.task;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Task lifecycle: {@code pending -> running -> completed | failed | cancelled}.
 * Terminal states are absorbing.
 */
public enum TaskStatus {
    /** Accepted, waiting for a worker */
    PENDING,
    /** A worker is executing the step function */
    RUNNING,
    /** Step function returned a result */
    COMPLETED,
    /** Step function raised an error */
    FAILED,
    /** Stopped at a checkpoint after a cancel request */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(TaskStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING;
            case RUNNING -> next.isTerminal();
            default -> false;
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
