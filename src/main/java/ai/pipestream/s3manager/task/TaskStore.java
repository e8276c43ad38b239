package ai.pipestream.s3manager.task;

import ai.pipestream.s3manager.config.TaskConfiguration;
import ai.pipestream.s3manager.exception.TaskNotFoundException;
import ai.pipestream.s3manager.exception.TaskRejectedException;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.RemovalCause;
import com.google.common.cache.RemovalListener;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.GuavaCacheMetrics;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory store for task records with bounded size and time-based retention.
 * <p>
 * Each record is an immutable {@link TaskSnapshot} swapped under a per-task lock, so
 * concurrent readers always see a complete snapshot and writers of different tasks never
 * contend.
 * <p>
 * Expiry:
 * <ul>
 *   <li>a terminal task stays queryable for {@code retention} after it finished;</li>
 *   <li>a running task is dropped once it has not been updated for {@code max-age};</li>
 *   <li>a pending task is never dropped, its worker is still queued.</li>
 * </ul>
 * Expired records read as not found even before {@link #sweep()} has physically removed
 * them. When {@code max-tasks} records are held, finished records are evicted oldest
 * first; a store full of live tasks rejects new ones.
 */
@ApplicationScoped
public class TaskStore {

    private static final Logger LOG = Logger.getLogger(TaskStore.class);

    private final Clock clock;
    private final Duration retention;
    private final Duration maxAge;
    private final int maxTasks;
    private final Object capacityLock = new Object();
    private final Cache<String, Entry> cache;
    private final Cache<String, Boolean> retiredIds;
    private final AtomicLong removedTotal = new AtomicLong(0);

    @Inject
    public TaskStore(TaskConfiguration config, MeterRegistry meterRegistry, Clock clock) {
        this.clock = clock;
        this.retention = config.retention();
        this.maxAge = config.maxAge();
        this.maxTasks = config.maxTasks();

        Ticker ticker = new Ticker() {
            @Override
            public long read() {
                return TimeUnit.MILLISECONDS.toNanos(clock.millis());
            }
        };

        this.retiredIds = CacheBuilder.newBuilder()
                .maximumSize(config.maxTasks())
                .expireAfterWrite(retention)
                .ticker(ticker)
                .build();

        RemovalListener<String, Entry> removalListener = notification -> {
            if (notification.getCause() == RemovalCause.REPLACED) {
                return;
            }
            removedTotal.incrementAndGet();
            retiredIds.put(notification.getKey(), Boolean.TRUE);
            LOG.debugf("Task record removed: taskId=%s, reason=%s",
                    notification.getKey(), notification.getCause());
        };

        this.cache = CacheBuilder.newBuilder()
                .removalListener(removalListener)
                .recordStats()
                .build();

        GuavaCacheMetrics.monitor(meterRegistry, cache, "task_store");
        meterRegistry.gauge("s3mgr_tasks_stored", cache, Cache::size);
        meterRegistry.gauge("s3mgr_tasks_removed_total", removedTotal, AtomicLong::get);

        LOG.infof("TaskStore initialized: maxTasks=%d, retention=%s, maxAge=%s",
                config.maxTasks(), retention, maxAge);
    }

    /**
     * Create a new task in {@code pending} state.
     *
     * @param kind     the task kind
     * @param metadata kind-specific parameters, read-only from now on
     * @return the new task id, unique among live and recently retired tasks
     * @throws TaskRejectedException if {@code max-tasks} live tasks are already held
     */
    public String create(TaskKind kind, Map<String, Object> metadata) {
        synchronized (capacityLock) {
            ensureCapacity();
            Instant now = clock.instant();
            while (true) {
                String id = UUID.randomUUID().toString();
                if (retiredIds.getIfPresent(id) != null) {
                    continue;
                }
                Entry entry = new Entry(TaskSnapshot.pending(id, kind, metadata, now));
                if (cache.asMap().putIfAbsent(id, entry) == null) {
                    LOG.debugf("Created task: taskId=%s, kind=%s", id, kind.wireName());
                    return id;
                }
            }
        }
    }

    private void ensureCapacity() {
        if (cache.size() < maxTasks) {
            return;
        }
        sweep();
        if (cache.size() < maxTasks) {
            return;
        }
        List<Map.Entry<String, Entry>> finished = new ArrayList<>();
        for (Map.Entry<String, Entry> e : cache.asMap().entrySet()) {
            if (e.getValue().snapshot.isTerminal()) {
                finished.add(e);
            }
        }
        finished.sort(Comparator.comparing(e -> e.getValue().snapshot.updatedAt()));
        int evicted = 0;
        for (Map.Entry<String, Entry> e : finished) {
            if (cache.size() < maxTasks) {
                break;
            }
            if (cache.asMap().remove(e.getKey(), e.getValue())) {
                evicted++;
            }
        }
        if (evicted > 0) {
            LOG.infof("Task store full: evicted %d finished records early", evicted);
        }
        if (cache.size() >= maxTasks) {
            LOG.warnf("Task store full: %d live tasks, rejecting new task", cache.size());
            throw TaskRejectedException.storeFull(maxTasks);
        }
    }

    /**
     * Get the current snapshot of a task.
     *
     * @return the snapshot, or empty if the id is unknown or the record has expired
     */
    public Optional<TaskSnapshot> get(String id) {
        if (id == null) {
            return Optional.empty();
        }
        Entry entry = cache.getIfPresent(id);
        if (entry == null) {
            return Optional.empty();
        }
        TaskSnapshot snapshot = entry.snapshot;
        if (isExpired(snapshot, clock.instant())) {
            cache.asMap().remove(id, entry);
            return Optional.empty();
        }
        return Optional.of(snapshot);
    }

    /**
     * @throws TaskNotFoundException if the id is unknown or the record has expired
     */
    public TaskSnapshot require(String id) {
        return get(id).orElseThrow(() -> new TaskNotFoundException(id));
    }

    /**
     * Atomically merge a partial change into a task.
     * <p>
     * Progress only moves forward, {@code completed} forces it to 100, status changes must
     * follow {@code pending -> running -> terminal}, a result is only accepted together with
     * {@code completed} and an error only together with {@code failed}.
     *
     * @throws IllegalStateException    on an illegal status transition
     * @throws IllegalArgumentException on a result/error that does not match the status
     */
    public UpdateResult update(String id, TaskUpdate update) {
        Entry entry = id == null ? null : cache.getIfPresent(id);
        if (entry == null) {
            return UpdateResult.NOT_FOUND;
        }
        synchronized (entry) {
            TaskSnapshot current = entry.snapshot;
            Instant now = clock.instant();
            if (isExpired(current, now)) {
                cache.asMap().remove(id, entry);
                return UpdateResult.NOT_FOUND;
            }
            if (current.isTerminal()) {
                return UpdateResult.ALREADY_TERMINAL;
            }

            TaskStatus next = update.status() != null ? update.status() : current.status();
            if (next != current.status() && !current.status().canTransitionTo(next)) {
                throw new IllegalStateException(String.format("Task %s cannot move from %s to %s",
                        id, current.status().wireName(), next.wireName()));
            }
            if (update.result() != null && next != TaskStatus.COMPLETED) {
                throw new IllegalArgumentException("A result is only allowed on completed tasks");
            }
            if (update.error() != null && next != TaskStatus.FAILED) {
                throw new IllegalArgumentException("An error is only allowed on failed tasks");
            }
            if (next == TaskStatus.FAILED && update.error() == null) {
                throw new IllegalArgumentException("A failed task requires an error");
            }

            int progress = current.progress();
            if (update.progress() != null) {
                progress = Math.max(progress, Math.min(100, Math.max(0, update.progress())));
            }
            if (next == TaskStatus.COMPLETED) {
                progress = 100;
            }

            TaskSnapshot.Builder builder = current.toBuilder()
                    .status(next)
                    .progress(progress)
                    .updatedAt(latest(current.updatedAt(), now));
            if (update.currentStep() != null) {
                builder.currentStep(update.currentStep());
            }
            if (next == TaskStatus.COMPLETED) {
                builder.result(update.result() != null ? update.result() : Map.of());
            }
            if (next == TaskStatus.FAILED) {
                builder.error(update.error());
            }
            entry.snapshot = builder.build();
        }
        return UpdateResult.UPDATED;
    }

    /**
     * Ask a running or pending task to stop at its next checkpoint.
     */
    public CancelResult requestCancel(String id) {
        Entry entry = id == null ? null : cache.getIfPresent(id);
        if (entry == null) {
            return CancelResult.NOT_FOUND;
        }
        synchronized (entry) {
            TaskSnapshot current = entry.snapshot;
            Instant now = clock.instant();
            if (isExpired(current, now)) {
                cache.asMap().remove(id, entry);
                return CancelResult.NOT_FOUND;
            }
            if (current.isTerminal()) {
                return CancelResult.ALREADY_TERMINAL;
            }
            if (current.cancelRequested()) {
                return CancelResult.ALREADY_REQUESTED;
            }
            entry.snapshot = current.toBuilder()
                    .cancelRequested(true)
                    .updatedAt(latest(current.updatedAt(), now))
                    .build();
        }
        LOG.infof("Cancellation requested for task %s", id);
        return CancelResult.REQUESTED;
    }

    /**
     * Snapshots of all live tasks, oldest first.
     */
    public List<TaskSnapshot> list() {
        Instant now = clock.instant();
        List<TaskSnapshot> snapshots = new ArrayList<>();
        for (Entry entry : cache.asMap().values()) {
            TaskSnapshot snapshot = entry.snapshot;
            if (!isExpired(snapshot, now)) {
                snapshots.add(snapshot);
            }
        }
        snapshots.sort(Comparator.comparing(TaskSnapshot::createdAt));
        return snapshots;
    }

    /**
     * Remove every record past its retention window or maximum age.
     *
     * @return number of records removed by this sweep
     */
    public int sweep() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, Entry> e : cache.asMap().entrySet()) {
            if (isExpired(e.getValue().snapshot, now) && cache.asMap().remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        cache.cleanUp();
        if (removed > 0) {
            LOG.debugf("Task sweep removed %d expired records", removed);
        }
        return removed;
    }

    public long size() {
        return cache.size();
    }

    public long getRemovedTotal() {
        return removedTotal.get();
    }

    private boolean isExpired(TaskSnapshot snapshot, Instant now) {
        if (snapshot.isTerminal()) {
            return !now.isBefore(snapshot.updatedAt().plus(retention));
        }
        if (snapshot.status() == TaskStatus.RUNNING) {
            // idle age: a running task that keeps reporting is never dropped
            return !now.isBefore(snapshot.updatedAt().plus(maxAge));
        }
        return false;
    }

    private static Instant latest(Instant previous, Instant now) {
        return now.isBefore(previous) ? previous : now;
    }

    private static final class Entry {
        private volatile TaskSnapshot snapshot;

        private Entry(TaskSnapshot snapshot) {
            this.snapshot = snapshot;
        }
    }
}
