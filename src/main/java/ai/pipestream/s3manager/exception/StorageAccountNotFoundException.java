package ai.pipestream.s3manager.exception;

/**
 * Thrown when a request names a storage account that is not configured.
 */
public class StorageAccountNotFoundException extends S3ManagerException {

    public StorageAccountNotFoundException(String accountName) {
        super("STORAGE_ACCOUNT_NOT_FOUND", "resolveStorageAccount",
            "Storage account not configured: " + accountName);
    }

    public static StorageAccountNotFoundException noDefault() {
        return new StorageAccountNotFoundException("<default>");
    }
}
