package ai.pipestream.s3manager.task;

import ai.pipestream.s3manager.access.AccessPolicy;
import ai.pipestream.s3manager.config.TaskConfiguration;
import ai.pipestream.s3manager.exception.AccessDeniedException;
import ai.pipestream.s3manager.exception.TaskNotFoundException;
import ai.pipestream.s3manager.exception.TaskRejectedException;
import ai.pipestream.s3manager.s3.ObjectStore;
import ai.pipestream.s3manager.s3.ObjectStoreFactory;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Entry point for background tasks.
 * <p>
 * Validates and authorizes a request synchronously, creates the task record and hands
 * the work to a fixed-size worker pool. The pool queue is unbounded: when every worker is
 * busy new tasks stay {@code pending} instead of being rejected.
 */
@ApplicationScoped
public class TaskDispatcher {

    private static final Logger LOG = Logger.getLogger(TaskDispatcher.class);

    private final TaskStore store;
    private final TaskExecutor executor;
    private final ObjectStoreFactory objectStores;
    private final AccessPolicy accessPolicy;
    private final TaskMetrics metrics;
    private final Map<TaskKind, StepFunction> steps;
    private final ThreadPoolExecutor workers;

    @Inject
    public TaskDispatcher(TaskStore store,
                          TaskExecutor executor,
                          ObjectStoreFactory objectStores,
                          AccessPolicy accessPolicy,
                          TaskConfiguration config,
                          TaskMetrics metrics,
                          @Any Instance<StepFunction> stepFunctions) {
        this(store, executor, objectStores, accessPolicy, config, metrics, (Iterable<StepFunction>) stepFunctions);
    }

    TaskDispatcher(TaskStore store,
                   TaskExecutor executor,
                   ObjectStoreFactory objectStores,
                   AccessPolicy accessPolicy,
                   TaskConfiguration config,
                   TaskMetrics metrics,
                   Iterable<StepFunction> stepFunctions) {
        this.store = store;
        this.executor = executor;
        this.objectStores = objectStores;
        this.accessPolicy = accessPolicy;
        this.metrics = metrics;
        this.steps = index(stepFunctions);
        this.workers = new ThreadPoolExecutor(
                config.workers(), config.workers(),
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new ThreadFactoryBuilder().setNameFormat("task-worker-%d").setDaemon(true).build());
        metrics.monitorPool(workers);
        LOG.infof("TaskDispatcher initialized: workers=%d, kinds=%s", config.workers(), steps.keySet());
    }

    /**
     * Every kind must be served by exactly one step function.
     */
    static Map<TaskKind, StepFunction> index(Iterable<StepFunction> stepFunctions) {
        Map<TaskKind, StepFunction> byKind = new EnumMap<>(TaskKind.class);
        for (StepFunction step : stepFunctions) {
            StepFunction previous = byKind.putIfAbsent(step.kind(), step);
            if (previous != null) {
                throw new IllegalStateException(String.format("Task kind %s is served by both %s and %s",
                        step.kind().wireName(), previous.getClass().getName(), step.getClass().getName()));
            }
        }
        for (TaskKind kind : TaskKind.values()) {
            if (!byKind.containsKey(kind)) {
                throw new IllegalStateException("No step function registered for task kind " + kind.wireName());
            }
        }
        return Collections.unmodifiableMap(byKind);
    }

    /**
     * Validate, authorize and enqueue a task. No task record exists when this throws a
     * validation, account or access error.
     *
     * @return the task as created, in {@code pending} state
     * @throws TaskRejectedException if the worker pool is shut down or the task store is full
     */
    public TaskSnapshot start(TaskKind kind, TaskParameters params, String callerId) {
        StepFunction step = steps.get(kind);
        step.validate(params);

        String account = objectStores.resolveAccount(params.storageAccount());
        accessPolicy.require(callerId, account, params.bucket(), step.requiredPermission());
        ObjectStore objectStore = objectStores.forAccount(account);

        TaskParameters resolved = new TaskParameters(account, params.bucket(), params.prefix(), params.keys());
        Map<String, Object> metadata = new LinkedHashMap<>(step.describe(resolved));
        metadata.put("storage_account", account);
        metadata.put("user_id", callerId);

        String taskId = store.create(kind, metadata);
        TaskSnapshot created = store.require(taskId);
        try {
            workers.execute(() -> executor.execute(taskId, step, resolved, objectStore));
        } catch (RejectedExecutionException e) {
            LOG.errorf("Task %s rejected by the worker pool", taskId);
            store.update(taskId, TaskUpdate.running("Rejected"));
            store.update(taskId, TaskUpdate.failed(
                    new TaskError("Worker pool is not accepting tasks", "SERVICE_UNAVAILABLE", "submitTask")));
            throw new TaskRejectedException(taskId, e);
        }

        metrics.recordStarted(kind);
        LOG.infof("Task %s accepted: kind=%s, account=%s, bucket=%s, user=%s",
                taskId, kind.wireName(), account, params.bucket(), callerId);
        return created;
    }

    /**
     * @throws TaskNotFoundException  if the task is unknown or expired
     * @throws AccessDeniedException if the caller may not see the task
     */
    public TaskSnapshot progress(String taskId, String callerId) {
        TaskSnapshot snapshot = store.require(taskId);
        checkOwnership(snapshot, callerId);
        return snapshot;
    }

    /**
     * Request cooperative cancellation. Idempotent.
     *
     * @throws TaskNotFoundException  if the task is unknown or expired
     * @throws AccessDeniedException if the caller may not see the task
     */
    public CancelResult cancel(String taskId, String callerId) {
        checkOwnership(store.require(taskId), callerId);
        CancelResult result = store.requestCancel(taskId);
        if (result == CancelResult.NOT_FOUND) {
            throw new TaskNotFoundException(taskId);
        }
        return result;
    }

    /**
     * Non-terminal tasks the caller may see, oldest first.
     */
    public List<TaskSnapshot> active(String callerId) {
        return store.list().stream()
                .filter(snapshot -> !snapshot.isTerminal())
                .filter(snapshot -> accessPolicy.canAccessTask(callerId, snapshot.ownerId()))
                .collect(Collectors.toList());
    }

    public boolean isAcceptingTasks() {
        return !workers.isShutdown();
    }

    public int activeWorkers() {
        return workers.getActiveCount();
    }

    public int queuedTasks() {
        return workers.getQueue().size();
    }

    @PreDestroy
    void shutdown() {
        LOG.info("Shutting down task worker pool");
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warnf("Task worker pool still busy after shutdown: active=%d, queued=%d",
                        workers.getActiveCount(), workers.getQueue().size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for task workers to finish");
        }
    }

    private void checkOwnership(TaskSnapshot snapshot, String callerId) {
        if (!accessPolicy.canAccessTask(callerId, snapshot.ownerId())) {
            LOG.warnf("User %s denied access to task %s", callerId, snapshot.id());
            throw AccessDeniedException.forTask(callerId, snapshot.id());
        }
    }
}
