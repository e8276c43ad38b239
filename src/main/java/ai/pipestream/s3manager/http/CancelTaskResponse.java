package ai.pipestream.s3manager.http;

/**
 * Outcome of a cancel call: {@code cancel_requested} or {@code already_done}.
 */
public record CancelTaskResponse(String taskId, String status, String message) {
}
