package ai.pipestream.s3manager.s3;

import ai.pipestream.s3manager.exception.StorageAccountNotFoundException;

/**
 * Resolves storage account references to {@link ObjectStore} instances.
 */
public interface ObjectStoreFactory {

    /**
     * Resolve a requested account reference to a configured account name.
     *
     * @param requested account name from the request, may be {@code null} or blank
     * @return the configured account name (the default account when none was requested)
     * @throws StorageAccountNotFoundException if the account is unknown or no default exists
     */
    String resolveAccount(String requested);

    /**
     * @param accountName a name previously returned by {@link #resolveAccount(String)}
     */
    ObjectStore forAccount(String accountName);
}
