package ai.pipestream.s3manager.task;

import ai.pipestream.s3manager.exception.S3ManagerException;

/**
 * Error payload of a failed task.
 *
 * @param message   stable, user-facing description
 * @param errorCode machine-readable code, e.g. {@code NOT_FOUND} or {@code STORE_UNAVAILABLE}
 * @param operation the operation that failed, e.g. {@code deleteObjects}
 */
public record TaskError(String message, String errorCode, String operation) {

    public static TaskError from(S3ManagerException e) {
        return new TaskError(e.getDetail(), e.getErrorCode(), e.getOperation());
    }

    public static TaskError internal(String operation, Throwable e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return new TaskError(message, "INTERNAL_ERROR", operation);
    }
}
