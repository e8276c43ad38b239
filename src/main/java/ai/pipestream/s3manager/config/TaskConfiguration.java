package ai.pipestream.s3manager.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

/**
 * Configuration for the background task subsystem.
 * All keys are namespaced under {@code s3mgr.tasks.*}.
 */
@ConfigMapping(prefix = "s3mgr.tasks")
public interface TaskConfiguration {

    /**
     * Number of tasks that may run concurrently. Further tasks wait in {@code pending}.
     * Default: 4.
     */
    @WithDefault("4")
    int workers();

    /**
     * How long a finished task stays queryable after reaching a terminal state.
     * Default: 60 seconds.
     */
    @WithDefault("PT60S")
    Duration retention();

    /**
     * Hard upper bound on how long any task record is kept, whatever its status.
     * Default: 24 hours.
     */
    @WithDefault("PT24H")
    Duration maxAge();

    /**
     * Maximum number of task records held in memory.
     * Default: 100000.
     */
    @WithDefault("100000")
    int maxTasks();

    /**
     * Interval between sweeps of expired task records, in scheduler syntax ({@code 30s}, {@code PT30S}).
     * Default: 30s.
     */
    @WithDefault("30s")
    String sweepInterval();

    /**
     * Objects requested per listing page.
     * Default: 1000.
     */
    @WithDefault("1000")
    int listPageSize();

    /**
     * Keys per batch delete call (S3 allows at most 1000).
     * Default: 100.
     */
    @WithDefault("100")
    int deleteBatchSize();

    /**
     * Full list-and-delete passes a bucket delete makes before giving up on a bucket
     * that keeps receiving objects.
     * Default: 3.
     */
    @WithDefault("3")
    int bucketDeleteAttempts();

    /**
     * Maximum number of keys accepted by a single bulk delete request.
     * Default: 100000.
     */
    @WithDefault("100000")
    int maxBulkKeys();
}
