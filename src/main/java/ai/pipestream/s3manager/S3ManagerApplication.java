package ai.pipestream.s3manager;

import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Main application entry point for the S3 Manager task service.
 * Runs long storage operations in the background and reports their progress.
 */
@QuarkusMain
@ApplicationScoped
public class S3ManagerApplication implements QuarkusApplication {

    private static final Logger LOG = Logger.getLogger(S3ManagerApplication.class);

    public static void main(String... args) {
        Quarkus.run(S3ManagerApplication.class, args);
    }

    @Override
    public int run(String... args) throws Exception {
        LOG.info("S3 Manager task service started");
        Quarkus.waitForExit();
        return 0;
    }
}
