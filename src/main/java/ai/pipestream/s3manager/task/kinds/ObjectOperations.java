package ai.pipestream.s3manager.task.kinds;

import ai.pipestream.s3manager.s3.BatchDeleteResult;
import ai.pipestream.s3manager.s3.ObjectPage;
import ai.pipestream.s3manager.s3.ObjectStore;
import ai.pipestream.s3manager.s3.ObjectSummary;
import ai.pipestream.s3manager.task.ProgressReporter;
import com.google.common.collect.Lists;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Listing and batch deletion shared by the step functions.
 * Both operations pass a cancellation checkpoint before every store call.
 */
final class ObjectOperations {

    private static final Logger LOG = Logger.getLogger(ObjectOperations.class);

    /** Upper bound S3 places on keys per DeleteObjects call. */
    static final int MAX_DELETE_BATCH = 1000;

    private ObjectOperations() {}

    /**
     * List every key under {@code prefix}, advancing progress by one point per page
     * within {@code [fromProgress, toProgress]}.
     */
    static List<String> listKeys(ObjectStore store, String bucket, String prefix, int pageSize,
                                 ProgressReporter reporter, int fromProgress, int toProgress) {
        List<String> keys = new ArrayList<>();
        String token = null;
        int pages = 0;
        do {
            reporter.checkpoint();
            ObjectPage page = store.list(bucket, prefix, token, pageSize);
            for (ObjectSummary object : page.objects()) {
                keys.add(object.key());
            }
            pages++;
            token = page.continuationToken();
            reporter.report(Math.min(toProgress, fromProgress + pages),
                    String.format("Listed %d objects", keys.size()));
        } while (token != null);
        LOG.debugf("Listed %d keys in %d pages: bucket=%s, prefix=%s", keys.size(), pages, bucket, prefix);
        return keys;
    }

    /**
     * Delete {@code keys} in batches. Per-key failures are collected; a failing store call
     * propagates and ends the deletion.
     */
    static DeletionOutcome deleteKeys(ObjectStore store, String bucket, List<String> keys, int batchSize,
                                      ProgressReporter reporter, int fromProgress, int toProgress) {
        int total = keys.size();
        int processed = 0;
        int deleted = 0;
        Map<String, String> failures = new LinkedHashMap<>();
        for (List<String> batch : Lists.partition(keys, Math.max(1, Math.min(batchSize, MAX_DELETE_BATCH)))) {
            reporter.checkpoint();
            BatchDeleteResult result = store.deleteBatch(bucket, batch);
            deleted += result.deleted().size();
            failures.putAll(result.failures());
            processed += batch.size();
            if (result.hasFailures()) {
                LOG.warnf("%d of %d keys could not be deleted from %s", result.failures().size(), batch.size(), bucket);
            }
            reporter.report(scale(processed, total, fromProgress, toProgress),
                    String.format("Deleted %d/%d objects", processed, total));
        }
        return new DeletionOutcome(deleted, failures);
    }

    static int scale(int done, int total, int fromProgress, int toProgress) {
        if (total == 0) {
            return toProgress;
        }
        return fromProgress + (int) ((long) done * (toProgress - fromProgress) / total);
    }
}
