package ai.pipestream.s3manager.access;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.Map;

/**
 * Per-user permissions, keyed by the caller id from the {@code x-user-id} header.
 * <pre>
 * s3mgr.access.enabled=true
 * s3mgr.access.users.alice.admin=true
 * s3mgr.access.users.bob.storage.primary=read
 * s3mgr.access.users.bob.buckets."primary/photos"=read-write
 * </pre>
 */
@ConfigMapping(prefix = "s3mgr.access")
public interface AccessConfiguration {

    /**
     * When disabled every caller is treated as an administrator.
     */
    @WithDefault("false")
    boolean enabled();

    Map<String, User> users();

    interface User {

        @WithDefault("false")
        boolean admin();

        /**
         * Default permission per storage account.
         */
        Map<String, Permission> storage();

        /**
         * Overrides for single buckets, keyed {@code <account>/<bucket>}.
         */
        Map<String, Permission> buckets();
    }
}
