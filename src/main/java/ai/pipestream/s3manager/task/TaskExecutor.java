package ai.pipestream.s3manager.task;

import ai.pipestream.s3manager.exception.S3ManagerException;
import ai.pipestream.s3manager.s3.ObjectStore;
import ai.pipestream.s3manager.util.TaskLogContext;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Map;

/**
 * Runs one task on the calling worker thread and owns its status transitions.
 * <p>
 * Outcome mapping:
 * <ul>
 *   <li>normal return: {@code completed} with the returned result</li>
 *   <li>{@link TaskCancelledException}: {@code cancelled}</li>
 *   <li>{@link S3ManagerException}: {@code failed} with its error code</li>
 *   <li>any other runtime exception: {@code failed} with {@code INTERNAL_ERROR}</li>
 *   <li>an {@link Error}: {@code failed} with {@code INTERNAL_ERROR}, then rethrown</li>
 * </ul>
 * If the record disappears from the store while running, the step function is stopped
 * at its next report or checkpoint and nothing further is written.
 */
@ApplicationScoped
public class TaskExecutor {

    private static final Logger LOG = Logger.getLogger(TaskExecutor.class);

    private final TaskStore store;
    private final TaskMetrics metrics;

    @Inject
    public TaskExecutor(TaskStore store, TaskMetrics metrics) {
        this.store = store;
        this.metrics = metrics;
    }

    public void execute(String taskId, StepFunction step, TaskParameters params, ObjectStore objectStore) {
        TaskLogContext.set(taskId, step.kind().wireName());
        Timer.Sample sample = metrics.startTimer();
        try {
            TaskStatus outcome = run(taskId, step, params, objectStore);
            if (outcome != null) {
                metrics.recordFinished(step.kind(), outcome, sample);
            }
        } finally {
            TaskLogContext.clear();
        }
    }

    private TaskStatus run(String taskId, StepFunction step, TaskParameters params, ObjectStore objectStore) {
        UpdateResult started = store.update(taskId, TaskUpdate.running(step.initialStep()));
        if (started != UpdateResult.UPDATED) {
            LOG.warnf("Task %s not started: record is %s", taskId, started);
            return null;
        }
        LOG.infof("Task %s started: kind=%s, bucket=%s", taskId, step.kind().wireName(), params.bucket());

        ProgressReporter reporter = new StoreProgressReporter(taskId);
        try {
            // a cancel that arrived while pending stops the task before any store call
            reporter.checkpoint();
            Map<String, Object> result = step.execute(params, objectStore, reporter);
            TaskStatus outcome = finish(taskId, TaskUpdate.completed(result), TaskStatus.COMPLETED);
            if (outcome != null) {
                LOG.infof("Task %s completed: %s", taskId, result);
            }
            return outcome;
        } catch (TaskCancelledException e) {
            LOG.infof("Task %s cancelled", taskId);
            return finish(taskId, TaskUpdate.cancelled(), TaskStatus.CANCELLED);
        } catch (TaskAbandonedException e) {
            LOG.warnf("Task %s stopped: %s", taskId, e.getMessage());
            return null;
        } catch (S3ManagerException e) {
            LOG.warnf("Task %s failed: %s", taskId, e.getMessage());
            return finish(taskId, TaskUpdate.failed(TaskError.from(e)), TaskStatus.FAILED);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Task %s failed with an unexpected error", taskId);
            return finish(taskId, TaskUpdate.failed(TaskError.internal(step.kind().wireName(), e)), TaskStatus.FAILED);
        } catch (Error e) {
            LOG.errorf(e, "Task %s aborted by a fatal error", taskId);
            finish(taskId, TaskUpdate.failed(TaskError.internal(step.kind().wireName(), e)), TaskStatus.FAILED);
            throw e;
        }
    }

    private TaskStatus finish(String taskId, TaskUpdate update, TaskStatus status) {
        UpdateResult result = store.update(taskId, update);
        if (result != UpdateResult.UPDATED) {
            LOG.warnf("Could not record %s for task %s: record is %s", status.wireName(), taskId, result);
            return null;
        }
        return status;
    }

    private final class StoreProgressReporter implements ProgressReporter {

        private final String taskId;

        private StoreProgressReporter(String taskId) {
            this.taskId = taskId;
        }

        @Override
        public void report(int progress, String currentStep) {
            UpdateResult result = store.update(taskId, TaskUpdate.progress(progress, currentStep));
            if (result != UpdateResult.UPDATED) {
                throw new TaskAbandonedException(taskId);
            }
            LOG.debugf("Task %s progress %d%%: %s", taskId, progress, currentStep);
        }

        @Override
        public boolean isCancelled() {
            return store.get(taskId)
                    .orElseThrow(() -> new TaskAbandonedException(taskId))
                    .cancelRequested();
        }
    }
}
