package ai.pipestream.s3manager.task;

/**
 * Raised at a checkpoint once a cancellation was requested. Work already done is kept.
 */
public class TaskCancelledException extends RuntimeException {

    public TaskCancelledException() {
        super("Task cancelled at checkpoint");
    }
}
