package ai.pipestream.s3manager.access;

import java.util.Locale;

/**
 * Permission level on a storage account or a single bucket.
 * Configured as {@code none}, {@code read} or {@code read-write}.
 */
public enum Permission {
    NONE,
    READ,
    READ_WRITE;

    public boolean allows(Permission required) {
        return ordinal() >= required.ordinal();
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
