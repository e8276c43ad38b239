package ai.pipestream.s3manager.task.kinds;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulated per-key outcome of deleting a set of keys in batches.
 */
record DeletionOutcome(int deletedCount, Map<String, String> failures) {

    List<String> failedKeys() {
        return new ArrayList<>(failures.keySet());
    }

    /**
     * Failures as {@code {key, message}} entries for the task result.
     */
    List<Map<String, Object>> errors() {
        List<Map<String, Object>> errors = new ArrayList<>(failures.size());
        failures.forEach((key, message) -> {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("key", key);
            error.put("message", message);
            errors.add(error);
        });
        return errors;
    }
}
