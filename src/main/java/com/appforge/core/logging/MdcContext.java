package com.appforge.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing generation-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setGeneration(String generationId) {
        MDC.put("generationId", generationId);
    }

    public static void setTask(String generationId, String taskId, String taskKind) {
        MDC.put("generationId", generationId);
        MDC.put("taskId", taskId);
        MDC.put("taskKind", taskKind);
    }

    public static void setProvider(String provider) {
        if (provider == null) {
            MDC.remove("provider");
        } else {
            MDC.put("provider", provider);
        }
    }

    public static void clear() {
        MDC.remove("generationId");
        MDC.remove("taskId");
        MDC.remove("taskKind");
        MDC.remove("provider");
    }
}
