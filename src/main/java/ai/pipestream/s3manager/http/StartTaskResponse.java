package ai.pipestream.s3manager.http;

/**
 * Returned with {@code 202 Accepted} once a task has been queued.
 */
public record StartTaskResponse(String taskId, String status, String message) {

    public static StartTaskResponse started(String taskId, String message) {
        return new StartTaskResponse(taskId, "started", message);
    }
}
