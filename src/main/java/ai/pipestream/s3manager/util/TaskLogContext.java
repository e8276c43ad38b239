package ai.pipestream.s3manager.util;

import org.jboss.logging.MDC;

/**
 * MDC keys attached to log lines written on behalf of a running task.
 */
public final class TaskLogContext {

    public static final String TASK_ID = "taskId";
    public static final String TASK_KIND = "taskKind";

    private TaskLogContext() {}

    public static void set(String taskId, String taskKind) {
        MDC.put(TASK_ID, taskId);
        MDC.put(TASK_KIND, taskKind);
    }

    public static void clear() {
        MDC.remove(TASK_ID);
        MDC.remove(TASK_KIND);
    }
}
