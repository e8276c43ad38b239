package ai.pipestream.s3manager.task;

import ai.pipestream.s3manager.access.Permission;
import ai.pipestream.s3manager.exception.InvalidRequestException;
import ai.pipestream.s3manager.s3.ObjectStore;

import java.util.Map;

/**
 * The body of one task kind.
 * <p>
 * {@link #validate} runs on the request thread before a task exists. {@link #execute}
 * runs on a worker thread; it reports progress and honours cancellation only through the
 * given {@link ProgressReporter}, and either returns the result map or throws.
 */
public interface StepFunction {

    TaskKind kind();

    /**
     * Permission the caller needs on the target bucket.
     */
    Permission requiredPermission();

    /**
     * @throws InvalidRequestException if the parameters cannot run
     */
    void validate(TaskParameters params);

    /**
     * Kind-specific metadata captured on the task record at creation.
     */
    Map<String, Object> describe(TaskParameters params);

    /**
     * Step text shown while the task moves to {@code running}.
     */
    String initialStep();

    Map<String, Object> execute(TaskParameters params, ObjectStore store, ProgressReporter reporter);
}
