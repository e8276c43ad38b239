package ai.pipestream.s3manager.s3;

import ai.pipestream.s3manager.exception.StorageAccountNotFoundException;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.S3AsyncClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds one {@link S3AsyncClient} per configured storage account and keeps it for the
 * lifetime of the application. Clients are created on first use.
 */
@ApplicationScoped
public class StorageClientRegistry {

    private static final Logger LOG = Logger.getLogger(StorageClientRegistry.class);

    private final StorageAccountsConfig config;
    private final ConcurrentHashMap<String, S3AsyncClient> clients = new ConcurrentHashMap<>();

    @Inject
    public StorageClientRegistry(StorageAccountsConfig config) {
        this.config = config;
    }

    /**
     * Get (or lazily create) the client for an account.
     *
     * @param accountName a configured account name
     * @return the shared client
     * @throws StorageAccountNotFoundException if the account is not configured
     */
    public S3AsyncClient clientFor(String accountName) {
        StorageAccountsConfig.Account account = config.accounts().get(accountName);
        if (account == null) {
            throw new StorageAccountNotFoundException(accountName);
        }
        return clients.computeIfAbsent(accountName, name -> build(name, account));
    }

    public int openClientCount() {
        return clients.size();
    }

    private S3AsyncClient build(String name, StorageAccountsConfig.Account account) {
        AwsBasicCredentials credentials = AwsBasicCredentials.create(account.accessKey(), account.secretKey());

        S3AsyncClientBuilder builder = S3AsyncClient.builder()
                .credentialsProvider(StaticCredentialsProvider.create(credentials))
                .region(Region.of(account.region()))
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(account.pathStyleAccess())
                        .build());
        account.endpoint().ifPresent(endpoint -> builder.endpointOverride(URI.create(endpoint)));

        LOG.infof("Created S3 client for storage account '%s' (endpoint=%s, region=%s)",
                name, account.endpoint().orElse("aws-default"), account.region());
        return builder.build();
    }

    @PreDestroy
    void close() {
        clients.forEach((name, client) -> {
            try {
                client.close();
            } catch (RuntimeException e) {
                LOG.warnf(e, "Failed to close S3 client for storage account '%s'", name);
            }
        });
        clients.clear();
    }
}
