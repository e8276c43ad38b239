package ai.pipestream.s3manager.http;

/**
 * Body of {@code POST /api/tasks/calculate-size}. Without a prefix the whole bucket is measured.
 */
public record CalculateSizeRequest(String bucketName, String prefix, String storageAccount) {
}
