package ai.pipestream.s3manager.s3;

import ai.pipestream.s3manager.exception.StorageAccountNotFoundException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Map;

/**
 * Resolves configured storage accounts to S3-backed object stores.
 */
@ApplicationScoped
public class S3ObjectStoreFactory implements ObjectStoreFactory {

    private final StorageAccountsConfig config;
    private final StorageClientRegistry clients;

    @Inject
    public S3ObjectStoreFactory(StorageAccountsConfig config, StorageClientRegistry clients) {
        this.config = config;
        this.clients = clients;
    }

    @Override
    public String resolveAccount(String requested) {
        return resolveAccountName(config, requested);
    }

    @Override
    public ObjectStore forAccount(String accountName) {
        return new S3ObjectStore(clients.clientFor(accountName));
    }

    /**
     * Shared resolution rules: an explicit name must be configured; no name means the
     * configured default, or the only account when just one exists.
     */
    static String resolveAccountName(StorageAccountsConfig config, String requested) {
        Map<String, StorageAccountsConfig.Account> accounts = config.accounts();
        if (requested != null && !requested.isBlank()) {
            if (!accounts.containsKey(requested)) {
                throw new StorageAccountNotFoundException(requested);
            }
            return requested;
        }
        if (config.defaultAccount().isPresent()) {
            String defaultAccount = config.defaultAccount().get();
            if (!accounts.containsKey(defaultAccount)) {
                throw new StorageAccountNotFoundException(defaultAccount);
            }
            return defaultAccount;
        }
        if (accounts.size() == 1) {
            return accounts.keySet().iterator().next();
        }
        throw StorageAccountNotFoundException.noDefault();
    }
}
