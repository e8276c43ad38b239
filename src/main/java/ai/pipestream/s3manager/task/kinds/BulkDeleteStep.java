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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deletes an explicit list of keys. Keys ending in {@code /} are folders and are expanded
 * to every object beneath them first.
 * <p>
 * Progress: preparing 5, expanding folders 5-15, deleting 15-100. Keys the store refuses
 * individually end up in {@code failed_keys}; the task still completes.
 */
@ApplicationScoped
public class BulkDeleteStep implements StepFunction {

    private final TaskConfiguration config;

    @Inject
    public BulkDeleteStep(TaskConfiguration config) {
        this.config = config;
    }

    @Override
    public TaskKind kind() {
        return TaskKind.BULK_DELETE;
    }

    @Override
    public Permission requiredPermission() {
        return Permission.READ_WRITE;
    }

    @Override
    public void validate(TaskParameters params) {
        BucketNames.validate("bulkDelete", params.bucket());
        List<String> keys = params.keys();
        if (keys.isEmpty()) {
            throw InvalidRequestException.missingField("bulkDelete", "keys");
        }
        if (keys.size() > config.maxBulkKeys()) {
            throw InvalidRequestException.tooManyKeys("bulkDelete", config.maxBulkKeys(), keys.size());
        }
        for (int i = 0; i < keys.size(); i++) {
            String key = keys.get(i);
            if (key == null || key.isBlank()) {
                throw InvalidRequestException.blankKey("bulkDelete", i);
            }
        }
    }

    @Override
    public Map<String, Object> describe(TaskParameters params) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("bucket_name", params.bucket());
        metadata.put("object_count", params.keys().size());
        metadata.put("action", "bulk_delete");
        return metadata;
    }

    @Override
    public String initialStep() {
        return "Preparing deletion";
    }

    @Override
    public Map<String, Object> execute(TaskParameters params, ObjectStore store, ProgressReporter reporter) {
        List<String> folders = new ArrayList<>();
        List<String> files = new ArrayList<>();
        for (String key : params.keys()) {
            if (key.endsWith("/")) {
                folders.add(key);
            } else {
                files.add(key);
            }
        }
        reporter.report(5, "Preparing deletion");

        Set<String> targets = new LinkedHashSet<>(files);
        if (!folders.isEmpty()) {
            reporter.report(5, String.format("Expanding %d folders", folders.size()));
            for (int i = 0; i < folders.size(); i++) {
                int from = ObjectOperations.scale(i, folders.size(), 5, 15);
                int to = ObjectOperations.scale(i + 1, folders.size(), 5, 15);
                targets.addAll(ObjectOperations.listKeys(store, params.bucket(), folders.get(i),
                        config.listPageSize(), reporter, from, to));
            }
        }
        List<String> keys = new ArrayList<>(targets);
        reporter.report(15, String.format("Deleting %d objects", keys.size()));

        DeletionOutcome outcome = ObjectOperations.deleteKeys(store, params.bucket(), keys,
                config.deleteBatchSize(), reporter, 15, 100);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("deleted_count", outcome.deletedCount());
        result.put("failed_count", outcome.failures().size());
        result.put("failed_keys", outcome.failedKeys());
        result.put("errors", outcome.errors());
        result.put("total", keys.size());
        result.put("folders", folders.size());
        result.put("files", files.size());
        return result;
    }
}
