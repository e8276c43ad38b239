package ai.pipestream.s3manager.task;

/**
 * Narrow view of the task record handed to a running {@link StepFunction}.
 * Step functions never touch the {@link TaskStore} directly.
 */
public interface ProgressReporter {

    /**
     * Record progress. Values below the last reported progress are ignored by the store.
     *
     * @param progress    percentage 0..100
     * @param currentStep human-readable description of the current step
     */
    void report(int progress, String currentStep);

    /**
     * @return whether a cancellation has been requested for this task
     */
    boolean isCancelled();

    /**
     * Cancellation checkpoint. Step functions call this before each page and each batch.
     *
     * @throws TaskCancelledException if a cancellation has been requested
     */
    default void checkpoint() {
        if (isCancelled()) {
            throw new TaskCancelledException();
        }
    }
}
