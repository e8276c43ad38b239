package ai.pipestream.s3manager.task;

/**
 * Outcome of {@link TaskStore#update}.
 */
public enum UpdateResult {
    /** Change applied */
    UPDATED,
    /** Task id unknown or expired */
    NOT_FOUND,
    /** Task already finished; terminal states are never changed */
    ALREADY_TERMINAL
}
