package com.pawpal.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing PawPal-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setOwner(String ownerId) {
        MDC.put("ownerId", ownerId);
    }

    public static void setTask(String ownerId, String subjectId, String taskId) {
        MDC.put("ownerId", ownerId);
        if (subjectId != null) {
            MDC.put("subjectId", subjectId);
        }
        MDC.put("taskId", taskId);
    }

    public static void clear() {
        MDC.remove("ownerId");
        MDC.remove("subjectId");
        MDC.remove("taskId");
    }
}
