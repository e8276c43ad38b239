package ai.pipestream.s3manager.task;

/**
 * Raised to a running step function when its task record no longer exists,
 * e.g. because the store evicted it. The worker stops without further reporting.
 */
public class TaskAbandonedException extends RuntimeException {

    public TaskAbandonedException(String taskId) {
        super("Task record no longer available: " + taskId);
    }
}
