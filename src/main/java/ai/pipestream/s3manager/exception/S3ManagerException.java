package ai.pipestream.s3manager.exception;

/**
 * Base exception for all S3 Manager operations.
 * Carries a stable error code and the operation that failed so callers can map it
 * to an HTTP status or record it on a failed task.
 */
public class S3ManagerException extends RuntimeException {

    private final String errorCode;
    private final String operation;
    private final String detail;

    public S3ManagerException(String errorCode, String operation, String message) {
        super(String.format("[%s] %s: %s", errorCode, operation, message));
        this.errorCode = errorCode;
        this.operation = operation;
        this.detail = message;
    }

    public S3ManagerException(String errorCode, String operation, String message, Throwable cause) {
        super(String.format("[%s] %s: %s", errorCode, operation, message), cause);
        this.errorCode = errorCode;
        this.operation = operation;
        this.detail = message;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * The message without the code/operation prefix, suitable for end users.
     */
    public String getDetail() {
        return detail;
    }
}
