package ai.pipestream.s3manager.task.kinds;

import ai.pipestream.s3manager.access.Permission;
import ai.pipestream.s3manager.config.TaskConfiguration;
import ai.pipestream.s3manager.s3.ObjectPage;
import ai.pipestream.s3manager.s3.ObjectStore;
import ai.pipestream.s3manager.s3.ObjectSummary;
import ai.pipestream.s3manager.task.ProgressReporter;
import ai.pipestream.s3manager.task.StepFunction;
import ai.pipestream.s3manager.task.TaskKind;
import ai.pipestream.s3manager.task.TaskParameters;
import ai.pipestream.s3manager.util.BucketNames;
import ai.pipestream.s3manager.util.SizeFormatter;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sums object sizes in a bucket, optionally under a prefix.
 */
@ApplicationScoped
public class CalculateSizeStep implements StepFunction {

    private final TaskConfiguration config;

    @Inject
    public CalculateSizeStep(TaskConfiguration config) {
        this.config = config;
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
        BucketNames.validate("calculateSize", params.bucket());
    }

    @Override
    public Map<String, Object> describe(TaskParameters params) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("bucket_name", params.bucket());
        metadata.put("prefix", params.prefix() != null ? params.prefix() : "");
        metadata.put("action", "calculate_size");
        return metadata;
    }

    @Override
    public String initialStep() {
        return "Counting objects";
    }

    @Override
    public Map<String, Object> execute(TaskParameters params, ObjectStore store, ProgressReporter reporter) {
        reporter.report(5, "Counting objects");
        long totalBytes = 0;
        long objectCount = 0;
        int pages = 0;
        String token = null;
        do {
            reporter.checkpoint();
            ObjectPage page = store.list(params.bucket(), params.prefix(), token, config.listPageSize());
            for (ObjectSummary object : page.objects()) {
                totalBytes += object.sizeBytes();
                objectCount++;
            }
            pages++;
            token = page.continuationToken();
            reporter.report(Math.min(95, 5 + 5 * pages),
                    String.format("Scanned %d objects (%s)", objectCount, SizeFormatter.format(totalBytes)));
        } while (token != null);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("size_bytes", totalBytes);
        result.put("size_formatted", SizeFormatter.format(totalBytes));
        result.put("object_count", objectCount);
        return result;
    }
}
