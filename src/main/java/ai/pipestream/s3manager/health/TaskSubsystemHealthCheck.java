package ai.pipestream.s3manager.health;

import ai.pipestream.s3manager.s3.StorageClientRegistry;
import ai.pipestream.s3manager.task.TaskDispatcher;
import ai.pipestream.s3manager.task.TaskStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Health check for the background task subsystem.
 * Ready while the worker pool accepts tasks.
 */
@Readiness
@ApplicationScoped
public class TaskSubsystemHealthCheck implements HealthCheck {

    @Inject
    TaskDispatcher dispatcher;

    @Inject
    TaskStore store;

    @Inject
    StorageClientRegistry clients;

    @Override
    public HealthCheckResponse call() {
        return HealthCheckResponse.named("s3-manager-tasks")
                .withData("workers", dispatcher.isAcceptingTasks() ? "accepting" : "shut down")
                .withData("activeWorkers", dispatcher.activeWorkers())
                .withData("queuedTasks", dispatcher.queuedTasks())
                .withData("storedTasks", store.size())
                .withData("storageClients", clients.openClientCount())
                .status(dispatcher.isAcceptingTasks())
                .build();
    }
}
