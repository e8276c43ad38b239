package ai.pipestream.s3manager.http;

import ai.pipestream.s3manager.access.AccessPolicy;
import ai.pipestream.s3manager.access.Permission;
import ai.pipestream.s3manager.exception.StorageAccountNotFoundException;
import ai.pipestream.s3manager.s3.ObjectStoreFactory;
import ai.pipestream.s3manager.s3.StorageAccountsConfig;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Read-only listing of the configured storage accounts the caller can use.
 */
@Path("/api/storage-accounts")
@Produces(MediaType.APPLICATION_JSON)
public class StorageAccountResource {

    private static final Logger LOG = Logger.getLogger(StorageAccountResource.class);

    @Inject
    StorageAccountsConfig config;

    @Inject
    ObjectStoreFactory objectStores;

    @Inject
    AccessPolicy accessPolicy;

    @GET
    public List<StorageAccountInfo> list(@HeaderParam(TaskResource.USER_HEADER) String userId) {
        String caller = accessPolicy.resolveCaller(userId);
        String defaultAccount = defaultAccount();
        List<StorageAccountInfo> accounts = new ArrayList<>();
        for (Map.Entry<String, StorageAccountsConfig.Account> entry : config.accounts().entrySet()) {
            if (!accessPolicy.isAdmin(caller)
                    && accessPolicy.storagePermission(caller, entry.getKey()) == Permission.NONE) {
                continue;
            }
            StorageAccountsConfig.Account account = entry.getValue();
            accounts.add(new StorageAccountInfo(
                    entry.getKey(),
                    account.endpoint().orElse(null),
                    account.region(),
                    account.pathStyleAccess(),
                    entry.getKey().equals(defaultAccount)));
        }
        accounts.sort(Comparator.comparing(StorageAccountInfo::name));
        return accounts;
    }

    private String defaultAccount() {
        try {
            return objectStores.resolveAccount(null);
        } catch (StorageAccountNotFoundException e) {
            LOG.debugf("No default storage account: %s", e.getDetail());
            return null;
        }
    }
}
