package ai.pipestream.s3manager.http;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Public view of a configured storage account. Credentials are never exposed.
 */
public record StorageAccountInfo(String name,
                                 String endpoint,
                                 String region,
                                 boolean pathStyleAccess,
                                 @JsonProperty("default") boolean isDefault) {
}
