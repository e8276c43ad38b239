package ai.pipestream.s3manager.task;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Input of a task as received from the caller. Each {@link StepFunction} validates the
 * fields it uses and ignores the rest.
 *
 * @param storageAccount configured account name, or {@code null} for the default account
 * @param bucket         target bucket
 * @param prefix         key prefix, may be {@code null}
 * @param keys           explicit keys, only used by bulk delete
 */
public record TaskParameters(String storageAccount, String bucket, String prefix, List<String> keys) {

    public TaskParameters {
        // null entries are kept so validation can reject them
        keys = keys == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(keys));
    }

    public static TaskParameters forBucket(String storageAccount, String bucket) {
        return new TaskParameters(storageAccount, bucket, null, null);
    }

    public static TaskParameters forPrefix(String storageAccount, String bucket, String prefix) {
        return new TaskParameters(storageAccount, bucket, prefix, null);
    }

    public static TaskParameters forKeys(String storageAccount, String bucket, List<String> keys) {
        return new TaskParameters(storageAccount, bucket, null, keys);
    }
}
