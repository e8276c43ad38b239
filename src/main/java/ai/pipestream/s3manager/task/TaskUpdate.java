package ai.pipestream.s3manager.task;

import java.util.Map;

/**
 * Partial change to a task. {@code null} fields are left untouched by {@link TaskStore#update}.
 */
public record TaskUpdate(
        Integer progress,
        String currentStep,
        TaskStatus status,
        Map<String, Object> result,
        TaskError error) {

    public static TaskUpdate progress(int progress, String currentStep) {
        return new TaskUpdate(progress, currentStep, null, null, null);
    }

    public static TaskUpdate running(String currentStep) {
        return new TaskUpdate(0, currentStep, TaskStatus.RUNNING, null, null);
    }

    public static TaskUpdate completed(Map<String, Object> result) {
        return new TaskUpdate(100, "Completed", TaskStatus.COMPLETED, result == null ? Map.of() : result, null);
    }

    public static TaskUpdate failed(TaskError error) {
        return new TaskUpdate(null, "Failed", TaskStatus.FAILED, null, error);
    }

    public static TaskUpdate cancelled() {
        return new TaskUpdate(null, "Cancelled", TaskStatus.CANCELLED, null, null);
    }
}
