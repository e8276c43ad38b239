package ai.pipestream.s3manager.exception;

/**
 * Thrown when a task id is unknown or its record has expired.
 */
public class TaskNotFoundException extends S3ManagerException {

    public TaskNotFoundException(String taskId) {
        super("TASK_NOT_FOUND", "findTask", "Task not found or expired: " + taskId);
    }
}
