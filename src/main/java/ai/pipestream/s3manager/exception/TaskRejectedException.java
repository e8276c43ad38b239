package ai.pipestream.s3manager.exception;

/**
 * Thrown when a task cannot be accepted: the worker pool is shut down or the task store
 * is full of live tasks.
 */
public class TaskRejectedException extends S3ManagerException {

    public TaskRejectedException(String taskId, Throwable cause) {
        super("SERVICE_UNAVAILABLE", "submitTask",
            "Worker pool is not accepting tasks, task " + taskId + " was not started", cause);
    }

    private TaskRejectedException(String message) {
        super("SERVICE_UNAVAILABLE", "submitTask", message);
    }

    public static TaskRejectedException storeFull(int maxTasks) {
        return new TaskRejectedException(
            String.format("Task store holds %d unfinished tasks, try again once some have finished", maxTasks));
    }
}
