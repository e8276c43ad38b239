package ai.pipestream.s3manager.http;

import ai.pipestream.s3manager.task.TaskError;
import ai.pipestream.s3manager.task.TaskKind;
import ai.pipestream.s3manager.task.TaskSnapshot;
import ai.pipestream.s3manager.task.TaskStatus;

import java.time.Instant;
import java.util.Map;

/**
 * Polling view of a task.
 */
public record TaskProgressResponse(
        String taskId,
        TaskKind taskKind,
        TaskStatus status,
        int progress,
        String currentStep,
        Map<String, Object> metadata,
        Map<String, Object> result,
        TaskError error,
        boolean cancelRequested,
        Instant createdAt,
        Instant updatedAt) {

    public static TaskProgressResponse from(TaskSnapshot task) {
        return new TaskProgressResponse(
                task.id(),
                task.kind(),
                task.status(),
                task.progress(),
                task.currentStep(),
                task.metadata(),
                task.result(),
                task.error(),
                task.cancelRequested(),
                task.createdAt(),
                task.updatedAt());
    }
}
