package ai.pipestream.s3manager.s3;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-key outcome of a batch delete.
 *
 * @param deleted  keys the store reported as deleted
 * @param failures keys the store refused, mapped to the store's error message
 */
public record BatchDeleteResult(List<String> deleted, Map<String, String> failures) {

    public BatchDeleteResult {
        deleted = List.copyOf(deleted);
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
