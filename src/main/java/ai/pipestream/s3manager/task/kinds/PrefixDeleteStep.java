package ai.pipestream.s3manager.task.kinds;

import ai.pipestream.s3manager.access.Permission;
import ai.pipestream.s3manager.config.TaskConfiguration;
import ai.pipestream.s3manager.exception.InvalidRequestException;
import ai.pipestream.s3manager.s3.ObjectStore;
import ai.pipestream.s3manager.task.ProgressReporter;
import ai.pipestream.s3manager.task.StepFunction;
import ai.pipestream.s3manager.task.TaskKind;
import ai.pipestream.s3manager.task.TaskParameters;
import ai.pipestream.s3manager.util.BucketNames;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deletes every object under a prefix ("folder delete"). The bucket itself is kept.
 * Progress: listing 0-10, deleting 10-100.
 */
@ApplicationScoped
public class PrefixDeleteStep implements StepFunction {

    private final TaskConfiguration config;

    @Inject
    public PrefixDeleteStep(TaskConfiguration config) {
        this.config = config;
    }

    @Override
    public TaskKind kind() {
        return TaskKind.PREFIX_DELETE;
    }

    @Override
    public Permission requiredPermission() {
        return Permission.READ_WRITE;
    }

    @Override
    public void validate(TaskParameters params) {
        BucketNames.validate("deletePrefix", params.bucket());
        String prefix = params.prefix();
        if (prefix == null || prefix.isBlank()) {
            throw InvalidRequestException.missingField("deletePrefix", "prefix");
        }
        if (prefix.startsWith("/")) {
            throw InvalidRequestException.invalidField("deletePrefix", "prefix", prefix, "must not start with '/'");
        }
    }

    @Override
    public Map<String, Object> describe(TaskParameters params) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("bucket_name", params.bucket());
        metadata.put("prefix", params.prefix());
        metadata.put("action", "delete_prefix");
        return metadata;
    }

    @Override
    public String initialStep() {
        return "Listing objects under prefix";
    }

    @Override
    public Map<String, Object> execute(TaskParameters params, ObjectStore store, ProgressReporter reporter) {
        List<String> keys = ObjectOperations.listKeys(store, params.bucket(), params.prefix(),
                config.listPageSize(), reporter, 0, 10);
        reporter.report(10, String.format("Found %d objects", keys.size()));

        DeletionOutcome outcome = ObjectOperations.deleteKeys(store, params.bucket(), keys,
                config.deleteBatchSize(), reporter, 10, 100);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("deleted_count", outcome.deletedCount());
        result.put("failed_count", outcome.failures().size());
        result.put("failed_keys", outcome.failedKeys());
        result.put("errors", outcome.errors());
        result.put("prefix", params.prefix());
        return result;
    }
}
