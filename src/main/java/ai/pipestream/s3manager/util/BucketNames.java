package ai.pipestream.s3manager.util;

import ai.pipestream.s3manager.exception.InvalidRequestException;

import java.util.regex.Pattern;

/**
 * S3 bucket naming rules.
 */
public final class BucketNames {

    private static final Pattern VALID = Pattern.compile("^[a-z0-9][a-z0-9.-]{1,61}[a-z0-9]$");
    private static final Pattern IP_ADDRESS = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");

    private BucketNames() {}

    public static boolean isValid(String bucket) {
        return bucket != null
                && VALID.matcher(bucket).matches()
                && !bucket.contains("..")
                && !IP_ADDRESS.matcher(bucket).matches();
    }

    /**
     * @throws InvalidRequestException if the name is missing or breaks the naming rules
     */
    public static void validate(String operation, String bucket) {
        if (bucket == null || bucket.isBlank()) {
            throw InvalidRequestException.missingField(operation, "bucket_name");
        }
        if (!isValid(bucket)) {
            throw InvalidRequestException.invalidField(operation, "bucket_name", bucket,
                    "must be 3-63 characters of lowercase letters, digits, dots and hyphens");
        }
    }
}
