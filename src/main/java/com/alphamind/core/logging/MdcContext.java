package com.alphamind.core.logging;

import com.alphamind.core.model.TaskKind;
import org.slf4j.MDC;

/**
 * Utility for managing Alphamind-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String taskId, TaskKind kind) {
        MDC.put("taskId", taskId);
        MDC.put("taskKind", kind.name().toLowerCase());
    }

    public static void setBranch(String taskId, int branchIndex) {
        MDC.put("taskId", taskId);
        MDC.put("branch", String.valueOf(branchIndex));
    }

    public static void clearBranch() {
        MDC.remove("branch");
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("taskKind");
        MDC.remove("branch");
    }
}
