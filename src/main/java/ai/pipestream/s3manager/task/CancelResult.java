package ai.pipestream.s3manager.task;

/**
 * Outcome of {@link TaskStore#requestCancel}.
 */
public enum CancelResult {
    /** Flag set by this call */
    REQUESTED,
    /** Flag was already set; idempotent no-op */
    ALREADY_REQUESTED,
    /** Task already finished; no-op */
    ALREADY_TERMINAL,
    /** Task id unknown or expired */
    NOT_FOUND
}
