package ai.pipestream.s3manager.exception;

/**
 * Thrown when the caller lacks permission for a bucket or a task.
 */
public class AccessDeniedException extends S3ManagerException {

    public AccessDeniedException(String operation, String message) {
        super("ACCESS_DENIED", operation, message);
    }

    public static AccessDeniedException forBucket(String userId, String account, String bucket, String required) {
        return new AccessDeniedException("authorize",
            String.format("User '%s' lacks %s permission on %s/%s", userId, required, account, bucket));
    }

    public static AccessDeniedException forTask(String userId, String taskId) {
        return new AccessDeniedException("authorizeTask",
            String.format("User '%s' may not access task %s", userId, taskId));
    }
}
