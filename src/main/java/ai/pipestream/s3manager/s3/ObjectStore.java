package ai.pipestream.s3manager.s3;

import ai.pipestream.s3manager.exception.ObjectStoreException;

import java.util.List;

/**
 * The object-storage capability background tasks depend on.
 * <p>
 * Every call is independent: there is no transactionality across calls, and a call may
 * be retried by the caller. Implementations must be safe for concurrent use.
 * Whole-call failures are reported as {@link ObjectStoreException}.
 */
public interface ObjectStore {

    /**
     * List one page of objects.
     *
     * @param bucket            bucket name
     * @param prefix            key prefix, or {@code null}/empty for the whole bucket
     * @param continuationToken token from the previous page, or {@code null} for the first page
     * @param maxKeys           page size
     */
    ObjectPage list(String bucket, String prefix, String continuationToken, int maxKeys);

    /**
     * Delete several objects in one call. Keys that fail individually are reported in the
     * result rather than thrown. Deleting a missing key is not an error.
     */
    BatchDeleteResult deleteBatch(String bucket, List<String> keys);

    /**
     * Delete the bucket container itself. Fails with
     * {@link ObjectStoreException.Reason#BUCKET_NOT_EMPTY} if objects remain.
     */
    void deleteBucket(String bucket);
}
