package ai.pipestream.s3manager.s3;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.Map;
import java.util.Optional;

/**
 * Configured S3-compatible storage accounts.
 *
 * Each account is addressed by its map key, e.g. {@code s3mgr.storage.accounts.primary.endpoint}.
 */
@ConfigMapping(prefix = "s3mgr.storage")
public interface StorageAccountsConfig {

    /**
     * Account used when a request does not name one.
     * Optional when exactly one account is configured.
     */
    Optional<String> defaultAccount();

    Map<String, Account> accounts();

    interface Account {

        /**
         * Endpoint override for non-AWS providers (MinIO, Ceph, Wasabi...).
         */
        Optional<String> endpoint();

        @WithDefault("us-east-1")
        String region();

        String accessKey();

        String secretKey();

        /**
         * Whether to use path-style access (required for most MinIO setups).
         */
        @WithDefault("true")
        boolean pathStyleAccess();
    }
}
