package ai.pipestream.s3manager.task;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Periodically removes expired task records.
 */
@ApplicationScoped
public class TaskSweeper {

    private static final Logger LOG = Logger.getLogger(TaskSweeper.class);

    @Inject
    TaskStore store;

    @Scheduled(every = "${s3mgr.tasks.sweep-interval}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void sweep() {
        int removed = store.sweep();
        if (removed > 0) {
            LOG.infof("Swept %d expired task records, %d remaining", removed, store.size());
        }
    }
}
