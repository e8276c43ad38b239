package ai.pipestream.s3manager.task.kinds;

import ai.pipestream.s3manager.access.Permission;
import ai.pipestream.s3manager.config.TaskConfiguration;
import ai.pipestream.s3manager.exception.ObjectStoreException;
import ai.pipestream.s3manager.s3.ObjectStore;
import ai.pipestream.s3manager.task.ProgressReporter;
import ai.pipestream.s3manager.task.StepFunction;
import ai.pipestream.s3manager.task.TaskKind;
import ai.pipestream.s3manager.task.TaskParameters;
import ai.pipestream.s3manager.util.BucketNames;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Empties a bucket and deletes it.
 * <p>
 * Progress: listing 0-10, deleting objects 10-85, deleting the bucket 85-100. A bucket
 * that is still not empty after the delete pass (new writes, keys that refused deletion)
 * gets another list-and-delete pass, up to the configured number of attempts.
 */
@ApplicationScoped
public class BucketDeleteStep implements StepFunction {

    private static final Logger LOG = Logger.getLogger(BucketDeleteStep.class);

    private final TaskConfiguration config;

    @Inject
    public BucketDeleteStep(TaskConfiguration config) {
        this.config = config;
    }

    @Override
    public TaskKind kind() {
        return TaskKind.BUCKET_DELETE;
    }

    @Override
    public Permission requiredPermission() {
        return Permission.READ_WRITE;
    }

    @Override
    public void validate(TaskParameters params) {
        BucketNames.validate("deleteBucket", params.bucket());
    }

    @Override
    public Map<String, Object> describe(TaskParameters params) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("bucket_name", params.bucket());
        metadata.put("action", "delete_bucket");
        return metadata;
    }

    @Override
    public String initialStep() {
        return "Listing objects";
    }

    @Override
    public Map<String, Object> execute(TaskParameters params, ObjectStore store, ProgressReporter reporter) {
        String bucket = params.bucket();
        int maxAttempts = Math.max(1, config.bucketDeleteAttempts());
        int deletedCount = 0;
        int attempt = 0;
        while (true) {
            attempt++;
            List<String> keys = ObjectOperations.listKeys(store, bucket, null, config.listPageSize(),
                    reporter, 0, 10);
            reporter.report(10, String.format("Found %d objects", keys.size()));

            DeletionOutcome outcome = ObjectOperations.deleteKeys(store, bucket, keys, config.deleteBatchSize(),
                    reporter, 10, 85);
            deletedCount += outcome.deletedCount();

            reporter.checkpoint();
            reporter.report(85, "Deleting bucket");
            try {
                store.deleteBucket(bucket);
                break;
            } catch (ObjectStoreException e) {
                if (e.getReason() != ObjectStoreException.Reason.BUCKET_NOT_EMPTY) {
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    throw new ObjectStoreException(ObjectStoreException.Reason.BUCKET_NOT_EMPTY, "deleteBucket",
                            bucket, String.format("objects remain after %d attempts", attempt), e);
                }
                LOG.warnf("Bucket %s not empty after attempt %d of %d, retrying", bucket, attempt, maxAttempts);
            }
        }
        reporter.report(100, "Bucket deleted");

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("deleted_count", deletedCount);
        result.put("bucket_name", bucket);
        result.put("attempts", attempt);
        return result;
    }
}
