package ai.pipestream.s3manager.exception;

/**
 * A task request rejected before any task is created. Carries the offending request field
 * in its wire spelling ({@code bucket_name}, {@code keys}, ...).
 */
public class InvalidRequestException extends S3ManagerException {

    private final String field;

    public InvalidRequestException(String operation, String field, String problem) {
        super("VALIDATION_ERROR", operation, String.format("Request field '%s' %s", field, problem));
        this.field = field;
    }

    public String getField() {
        return field;
    }

    public static InvalidRequestException missingField(String operation, String field) {
        return new InvalidRequestException(operation, field, "is required");
    }

    public static InvalidRequestException invalidField(String operation, String field, String value, String reason) {
        return new InvalidRequestException(operation, field, String.format("rejects '%s': %s", value, reason));
    }

    public static InvalidRequestException tooManyKeys(String operation, int max, int actual) {
        return new InvalidRequestException(operation, "keys",
            String.format("accepts at most %d keys per request, got %d", max, actual));
    }

    public static InvalidRequestException blankKey(String operation, int index) {
        return new InvalidRequestException(operation, "keys",
            String.format("has a null or blank key at position %d", index));
    }
}
