package ai.pipestream.s3manager.http;

import java.util.List;

/**
 * Body of {@code POST /api/tasks/bulk-delete}. Keys ending in {@code /} are folders.
 */
public record BulkDeleteRequest(String bucketName, List<String> keys, String storageAccount) {
}
