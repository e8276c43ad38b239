package ai.pipestream.s3manager.task;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Metrics for background tasks.
 * Exposes per-kind counters and timers plus worker pool gauges via Micrometer.
 */
@ApplicationScoped
public class TaskMetrics {

    @Inject
    MeterRegistry registry;

    private final Map<TaskKind, Counter> startedTotal = new EnumMap<>(TaskKind.class);
    private final Map<TaskKind, Map<TaskStatus, Counter>> finishedTotal = new EnumMap<>(TaskKind.class);
    private final Map<TaskKind, Timer> duration = new EnumMap<>(TaskKind.class);

    @PostConstruct
    void init() {
        for (TaskKind kind : TaskKind.values()) {
            startedTotal.put(kind, Counter.builder("s3mgr_tasks_started_total")
                    .description("Total number of tasks accepted")
                    .tag("kind", kind.wireName())
                    .register(registry));

            Map<TaskStatus, Counter> byStatus = new EnumMap<>(TaskStatus.class);
            for (TaskStatus status : TaskStatus.values()) {
                if (status.isTerminal()) {
                    byStatus.put(status, Counter.builder("s3mgr_tasks_finished_total")
                            .description("Total number of tasks that reached a terminal state")
                            .tag("kind", kind.wireName())
                            .tag("status", status.wireName())
                            .register(registry));
                }
            }
            finishedTotal.put(kind, byStatus);

            duration.put(kind, Timer.builder("s3mgr_task_duration")
                    .description("Time from a worker picking a task up to its terminal state")
                    .tag("kind", kind.wireName())
                    .publishPercentiles(0.5, 0.95, 0.99)
                    .register(registry));
        }
    }

    /**
     * Gauges for the worker pool backing the dispatcher.
     */
    public void monitorPool(ThreadPoolExecutor pool) {
        registry.gauge("s3mgr_task_workers_active", pool, ThreadPoolExecutor::getActiveCount);
        registry.gauge("s3mgr_tasks_queued", pool, p -> p.getQueue().size());
    }

    public void recordStarted(TaskKind kind) {
        startedTotal.get(kind).increment();
    }

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void recordFinished(TaskKind kind, TaskStatus status, Timer.Sample sample) {
        Counter counter = finishedTotal.get(kind).get(status);
        if (counter != null) {
            counter.increment();
        }
        sample.stop(duration.get(kind));
    }
}
