package ai.pipestream.s3manager.s3;

import ai.pipestream.s3manager.exception.ObjectStoreException;
import org.jboss.logging.Logger;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.Delete;
import software.amazon.awssdk.services.s3.model.DeleteBucketRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.ObjectIdentifier;
import software.amazon.awssdk.services.s3.model.S3Error;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * {@link ObjectStore} backed by the AWS SDK v2 asynchronous S3 client.
 * Calls block on the returned futures; callers are background workers, never request threads.
 */
public class S3ObjectStore implements ObjectStore {

    private static final Logger LOG = Logger.getLogger(S3ObjectStore.class);

    private final S3AsyncClient s3;

    public S3ObjectStore(S3AsyncClient s3) {
        this.s3 = s3;
    }

    @Override
    public ObjectPage list(String bucket, String prefix, String continuationToken, int maxKeys) {
        ListObjectsV2Request.Builder request = ListObjectsV2Request.builder()
                .bucket(bucket)
                .maxKeys(maxKeys);
        if (prefix != null && !prefix.isEmpty()) {
            request.prefix(prefix);
        }
        if (continuationToken != null) {
            request.continuationToken(continuationToken);
        }

        ListObjectsV2Response response = join(s3.listObjectsV2(request.build()), "listObjects", bucket);

        List<ObjectSummary> objects = new ArrayList<>(response.contents().size());
        response.contents().forEach(o -> objects.add(new ObjectSummary(o.key(), o.size() != null ? o.size() : 0L)));
        String next = Boolean.TRUE.equals(response.isTruncated()) ? response.nextContinuationToken() : null;
        return new ObjectPage(objects, next);
    }

    @Override
    public BatchDeleteResult deleteBatch(String bucket, List<String> keys) {
        if (keys.isEmpty()) {
            return new BatchDeleteResult(List.of(), Map.of());
        }
        List<ObjectIdentifier> identifiers = keys.stream()
                .map(key -> ObjectIdentifier.builder().key(key).build())
                .toList();

        DeleteObjectsRequest request = DeleteObjectsRequest.builder()
                .bucket(bucket)
                .delete(Delete.builder().objects(identifiers).quiet(true).build())
                .build();

        DeleteObjectsResponse response = join(s3.deleteObjects(request), "deleteObjects", bucket);

        // Quiet mode: only failures are listed, everything else was deleted
        Map<String, String> failures = new LinkedHashMap<>();
        for (S3Error error : response.errors()) {
            failures.put(error.key(), error.code() + ": " + error.message());
        }
        List<String> deleted = keys.stream().filter(key -> !failures.containsKey(key)).toList();
        if (!failures.isEmpty()) {
            LOG.debugf("deleteObjects on %s: %d deleted, %d failed", bucket, deleted.size(), failures.size());
        }
        return new BatchDeleteResult(deleted, failures);
    }

    @Override
    public void deleteBucket(String bucket) {
        join(s3.deleteBucket(DeleteBucketRequest.builder().bucket(bucket).build()), "deleteBucket", bucket);
    }

    private static <T> T join(CompletableFuture<T> future, String operation, String bucket) {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw translate(e.getCause() != null ? e.getCause() : e, operation, bucket);
        }
    }

    static ObjectStoreException translate(Throwable error, String operation, String bucket) {
        if (error instanceof NoSuchBucketException) {
            return ObjectStoreException.bucketNotFound(operation, bucket);
        }
        if (error instanceof S3Exception s3Error) {
            String code = s3Error.awsErrorDetails() != null ? s3Error.awsErrorDetails().errorCode() : null;
            String details = s3Error.awsErrorDetails() != null
                    ? s3Error.awsErrorDetails().errorMessage()
                    : s3Error.getMessage();
            if ("BucketNotEmpty".equals(code)) {
                return new ObjectStoreException(ObjectStoreException.Reason.BUCKET_NOT_EMPTY, operation, bucket, details, error);
            }
            if (s3Error.statusCode() == 404 || "NoSuchBucket".equals(code)) {
                return ObjectStoreException.bucketNotFound(operation, bucket);
            }
            if (s3Error.statusCode() == 403) {
                return new ObjectStoreException(ObjectStoreException.Reason.ACCESS_DENIED, operation, bucket, details, error);
            }
            return ObjectStoreException.unavailable(operation, bucket, error);
        }
        // SdkClientException and anything else: transport or backend failure
        return ObjectStoreException.unavailable(operation, bucket, error);
    }
}
