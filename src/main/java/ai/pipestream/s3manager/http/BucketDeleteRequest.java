package ai.pipestream.s3manager.http;

/**
 * Body of {@code POST /api/tasks/bucket-delete/{bucket}}.
 */
public record BucketDeleteRequest(String storageAccount) {
}
