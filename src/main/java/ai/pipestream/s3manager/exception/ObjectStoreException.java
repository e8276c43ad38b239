package ai.pipestream.s3manager.exception;

/**
 * Thrown when a call against the object store fails as a whole.
 * Per-key failures inside a batch delete are not reported through this exception.
 */
public class ObjectStoreException extends S3ManagerException {

    public enum Reason {
        NOT_FOUND,
        ACCESS_DENIED,
        BUCKET_NOT_EMPTY,
        UNAVAILABLE
    }

    private final Reason reason;

    public ObjectStoreException(Reason reason, String operation, String bucket, String details) {
        super(reason == Reason.UNAVAILABLE ? "STORE_UNAVAILABLE" : reason.name(), operation,
            String.format("%s failed for bucket '%s': %s", operation, bucket, details));
        this.reason = reason;
    }

    public ObjectStoreException(Reason reason, String operation, String bucket, String details, Throwable cause) {
        super(reason == Reason.UNAVAILABLE ? "STORE_UNAVAILABLE" : reason.name(), operation,
            String.format("%s failed for bucket '%s': %s", operation, bucket, details), cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public static ObjectStoreException bucketNotFound(String operation, String bucket) {
        return new ObjectStoreException(Reason.NOT_FOUND, operation, bucket, "bucket does not exist");
    }

    public static ObjectStoreException unavailable(String operation, String bucket, Throwable cause) {
        String details = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new ObjectStoreException(Reason.UNAVAILABLE, operation, bucket, details, cause);
    }
}
