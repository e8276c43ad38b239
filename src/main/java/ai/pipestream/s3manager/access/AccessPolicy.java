package ai.pipestream.s3manager.access;

import ai.pipestream.s3manager.exception.AccessDeniedException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Resolves effective permissions.
 * <p>
 * Hierarchy:
 * <ol>
 *   <li>Admins have full access to everything.</li>
 *   <li>A bucket override, when present, decides.</li>
 *   <li>Otherwise the storage account permission applies; unknown means {@link Permission#NONE}.</li>
 * </ol>
 */
@ApplicationScoped
public class AccessPolicy {

    private static final Logger LOG = Logger.getLogger(AccessPolicy.class);

    public static final String ANONYMOUS = "anonymous";

    private final AccessConfiguration config;

    @Inject
    public AccessPolicy(AccessConfiguration config) {
        this.config = config;
    }

    public boolean isEnabled() {
        return config.enabled();
    }

    /**
     * Normalize the caller id taken from the request.
     *
     * @throws AccessDeniedException if access control is enabled and no id was supplied
     */
    public String resolveCaller(String headerValue) {
        if (headerValue != null && !headerValue.isBlank()) {
            return headerValue.trim();
        }
        if (config.enabled()) {
            throw new AccessDeniedException("identify", "Caller identity header x-user-id is required");
        }
        return ANONYMOUS;
    }

    public boolean isAdmin(String userId) {
        if (!config.enabled()) {
            return true;
        }
        AccessConfiguration.User user = config.users().get(userId);
        return user != null && user.admin();
    }

    /**
     * Permission on a storage account as a whole, ignoring bucket overrides.
     */
    public Permission storagePermission(String userId, String account) {
        if (isAdmin(userId)) {
            return Permission.READ_WRITE;
        }
        AccessConfiguration.User user = config.users().get(userId);
        return user == null ? Permission.NONE : user.storage().getOrDefault(account, Permission.NONE);
    }

    public Permission effectivePermission(String userId, String account, String bucket) {
        Permission storagePermission = storagePermission(userId, account);
        if (isAdmin(userId)) {
            return storagePermission;
        }
        if (storagePermission == Permission.NONE) {
            // No access to the storage hides every bucket in it
            return Permission.NONE;
        }
        Permission bucketOverride = config.users().get(userId).buckets().get(account + "/" + bucket);
        return bucketOverride != null ? bucketOverride : storagePermission;
    }

    /**
     * @throws AccessDeniedException if the caller's effective permission is below {@code required}
     */
    public void require(String userId, String account, String bucket, Permission required) {
        Permission effective = effectivePermission(userId, account, bucket);
        if (!effective.allows(required)) {
            LOG.warnf("Denied %s on %s/%s for user %s (effective=%s)",
                    required.wireName(), account, bucket, userId, effective.wireName());
            throw AccessDeniedException.forBucket(userId, account, bucket, required.wireName());
        }
    }

    /**
     * Tasks are visible to their creator and to admins.
     */
    public boolean canAccessTask(String userId, String ownerId) {
        return isAdmin(userId) || userId.equals(ownerId);
    }
}
