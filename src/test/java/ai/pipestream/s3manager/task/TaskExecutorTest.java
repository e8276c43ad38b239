package ai.pipestream.s3manager.task;

import ai.pipestream.s3manager.access.Permission;
import ai.pipestream.s3manager.s3.InMemoryObjectStore;
import ai.pipestream.s3manager.s3.ObjectStore;
import ai.pipestream.s3manager.support.MutableClock;
import ai.pipestream.s3manager.support.TestTaskConfiguration;
import ai.pipestream.s3manager.util.TaskLogContext;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.jboss.logging.MDC;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for TaskExecutor: status transitions and error classification.
 */
class TaskExecutorTest {

    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private TaskStore store;
    private TaskExecutor executor;
    private InMemoryObjectStore objectStore;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        registry = new SimpleMeterRegistry();
        store = new TaskStore(new TestTaskConfiguration().maxAge(Duration.ofHours(1)), registry, clock);
        TaskMetrics metrics = new TaskMetrics();
        metrics.registry = registry;
        metrics.init();
        executor = new TaskExecutor(store, metrics);
        objectStore = new InMemoryObjectStore().createBucket("photos");
    }

    @Test
    @DisplayName("A step that returns normally completes the task with its result")
    void normalReturnCompletes() {
        String id = store.create(TaskKind.CALCULATE_SIZE, Map.of());
        ScriptedStep step = new ScriptedStep((objects, reporter) -> {
            reporter.report(50, "Halfway");
            return Map.of("size_bytes", 42L);
        });

        executor.execute(id, step, TaskParameters.forBucket("main", "photos"), objectStore);

        TaskSnapshot task = store.require(id);
        assertThat(task.status()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(task.progress()).isEqualTo(100);
        assertThat(task.currentStep()).isEqualTo("Completed");
        assertThat(task.result()).containsEntry("size_bytes", 42L);
        assertThat(registry.get("s3mgr_tasks_finished_total")
                .tag("kind", "calculate-size").tag("status", "completed")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get("s3mgr_task_duration").tag("kind", "calculate-size").timer().count())
                .isEqualTo(1);
    }

    @Test
    @DisplayName("A cancel requested while pending ends the task without running the step")
    void cancelWhilePendingSkipsStep() {
        String id = store.create(TaskKind.BUCKET_DELETE, Map.of());
        store.requestCancel(id);
        AtomicBoolean ran = new AtomicBoolean();
        ScriptedStep step = new ScriptedStep((objects, reporter) -> {
            ran.set(true);
            objects.list("photos", null, null, 10);
            return Map.of();
        });

        executor.execute(id, step, TaskParameters.forBucket("main", "photos"), objectStore);

        TaskSnapshot task = store.require(id);
        assertThat(task.status()).isEqualTo(TaskStatus.CANCELLED);
        assertThat(task.result()).isNull();
        assertThat(task.error()).isNull();
        assertThat(ran).isFalse();
        assertThat(objectStore.totalCalls()).isZero();
    }

    @Test
    void cancelDuringExecutionStopsAtCheckpoint() {
        String id = store.create(TaskKind.PREFIX_DELETE, Map.of());
        AtomicBoolean pastCheckpoint = new AtomicBoolean();
        ScriptedStep step = new ScriptedStep((objects, reporter) -> {
            reporter.report(40, "Deleting");
            store.requestCancel(id);
            reporter.checkpoint();
            pastCheckpoint.set(true);
            return Map.of();
        });

        executor.execute(id, step, TaskParameters.forPrefix("main", "photos", "a/"), objectStore);

        TaskSnapshot task = store.require(id);
        assertThat(task.status()).isEqualTo(TaskStatus.CANCELLED);
        assertThat(task.progress()).isEqualTo(40);
        assertThat(task.currentStep()).isEqualTo("Cancelled");
        assertThat(pastCheckpoint).isFalse();
    }

    @Test
    void storeErrorFailsTaskWithItsCode() {
        String id = store.create(TaskKind.BUCKET_DELETE, Map.of());
        objectStore.failOperation("listObjects");
        ScriptedStep step = new ScriptedStep((objects, reporter) -> {
            objects.list("photos", null, null, 10);
            return Map.of();
        });

        executor.execute(id, step, TaskParameters.forBucket("main", "photos"), objectStore);

        TaskSnapshot task = store.require(id);
        assertThat(task.status()).isEqualTo(TaskStatus.FAILED);
        assertThat(task.result()).isNull();
        assertThat(task.error().errorCode()).isEqualTo("STORE_UNAVAILABLE");
        assertThat(task.error().operation()).isEqualTo("listObjects");
        assertThat(task.error().message()).contains("photos");
    }

    @Test
    void missingBucketFailsWithNotFound() {
        String id = store.create(TaskKind.CALCULATE_SIZE, Map.of());
        ScriptedStep step = new ScriptedStep((objects, reporter) -> {
            objects.list("nope", null, null, 10);
            return Map.of();
        });

        executor.execute(id, step, TaskParameters.forBucket("main", "nope"), objectStore);

        assertThat(store.require(id).error().errorCode()).isEqualTo("NOT_FOUND");
    }

    @Test
    void unexpectedErrorFailsWithInternalError() {
        String id = store.create(TaskKind.BULK_DELETE, Map.of());
        ScriptedStep step = new ScriptedStep((objects, reporter) -> {
            throw new IllegalStateException("unexpected");
        });

        executor.execute(id, step, TaskParameters.forKeys("main", "photos", List.of("a")), objectStore);

        TaskSnapshot task = store.require(id);
        assertThat(task.status()).isEqualTo(TaskStatus.FAILED);
        assertThat(task.error().errorCode()).isEqualTo("INTERNAL_ERROR");
        assertThat(task.error().message()).isEqualTo("unexpected");
    }

    @Test
    @DisplayName("A fatal error escaping the step still leaves the task failed")
    void fatalErrorFailsTaskAndPropagates() {
        String id = store.create(TaskKind.BUCKET_DELETE, Map.of());
        ScriptedStep step = new ScriptedStep((objects, reporter) -> {
            reporter.report(30, "Deleting");
            throw new StackOverflowError();
        });

        assertThatThrownBy(() -> executor.execute(id, step, TaskParameters.forBucket("main", "photos"), objectStore))
                .isInstanceOf(StackOverflowError.class);

        TaskSnapshot task = store.require(id);
        assertThat(task.status()).isEqualTo(TaskStatus.FAILED);
        assertThat(task.error().errorCode()).isEqualTo("INTERNAL_ERROR");
        assertThat(task.error().message()).isEqualTo("StackOverflowError");
        assertThat(MDC.get(TaskLogContext.TASK_ID)).isNull();
    }

    @Test
    @DisplayName("A vanished task record stops the step without an error")
    void vanishedRecordStopsStep() {
        String id = store.create(TaskKind.BUCKET_DELETE, Map.of());
        AtomicBoolean reachedEnd = new AtomicBoolean();
        ScriptedStep step = new ScriptedStep((objects, reporter) -> {
            reporter.report(10, "Listing");
            clock.advance(Duration.ofHours(2));
            reporter.report(20, "Deleting");
            reachedEnd.set(true);
            return Map.of();
        });

        executor.execute(id, step, TaskParameters.forBucket("main", "photos"), objectStore);

        assertThat(reachedEnd).isFalse();
        assertThat(store.get(id)).isEmpty();
        assertThat(registry.get("s3mgr_task_duration").tag("kind", "calculate-size").timer().count()).isZero();
    }

    @Test
    void taskContextIsInMdcWhileRunning() {
        String id = store.create(TaskKind.CALCULATE_SIZE, Map.of());
        AtomicReference<Object> seenId = new AtomicReference<>();
        AtomicReference<Object> seenKind = new AtomicReference<>();
        ScriptedStep step = new ScriptedStep((objects, reporter) -> {
            seenId.set(MDC.get(TaskLogContext.TASK_ID));
            seenKind.set(MDC.get(TaskLogContext.TASK_KIND));
            return Map.of();
        });

        executor.execute(id, step, TaskParameters.forBucket("main", "photos"), objectStore);

        assertThat(seenId.get()).isEqualTo(id);
        assertThat(seenKind.get()).isEqualTo("calculate-size");
        assertThat(MDC.get(TaskLogContext.TASK_ID)).isNull();
    }

    @Test
    void alreadyCancelledRecordIsNotStartedAgain() {
        String id = store.create(TaskKind.CALCULATE_SIZE, Map.of());
        store.update(id, TaskUpdate.running("Counting"));
        store.update(id, TaskUpdate.cancelled());
        AtomicBoolean ran = new AtomicBoolean();

        executor.execute(id, new ScriptedStep((objects, reporter) -> {
            ran.set(true);
            return Map.of();
        }), TaskParameters.forBucket("main", "photos"), objectStore);

        assertThat(ran).isFalse();
        assertThat(store.require(id).status()).isEqualTo(TaskStatus.CANCELLED);
    }

    private static final class ScriptedStep implements StepFunction {

        private final BiFunction<ObjectStore, ProgressReporter, Map<String, Object>> body;

        private ScriptedStep(BiFunction<ObjectStore, ProgressReporter, Map<String, Object>> body) {
            this.body = body;
        }

        @Override
        public TaskKind kind() {
            return TaskKind.CALCULATE_SIZE;
        }

        @Override
        public Permission requiredPermission() {
            return Permission.READ;
        }

        @Override
        public void validate(TaskParameters params) {
        }

        @Override
        public Map<String, Object> describe(TaskParameters params) {
            return Map.of();
        }

        @Override
        public String initialStep() {
            return "Starting";
        }

        @Override
        public Map<String, Object> execute(TaskParameters params, ObjectStore store, ProgressReporter reporter) {
            return body.apply(store, reporter);
        }
    }
}
