package ai.pipestream.s3manager.s3;

/**
 * One listed object: its key and size in bytes.
 */
public record ObjectSummary(String key, long sizeBytes) {
}
