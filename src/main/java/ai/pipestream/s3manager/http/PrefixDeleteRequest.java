package ai.pipestream.s3manager.http;

/**
 * Body of {@code POST /api/tasks/prefix-delete/{bucket}}.
 */
public record PrefixDeleteRequest(String prefix, String storageAccount) {
}
