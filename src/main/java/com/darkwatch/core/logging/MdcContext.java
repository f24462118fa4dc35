package com.darkwatch.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Darkwatch-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSource(String sourceId) {
        MDC.put("sourceId", sourceId);
    }

    public static void setOperation(String sourceId, String operation) {
        MDC.put("sourceId", sourceId);
        MDC.put("operation", operation);
    }

    public static void clear() {
        MDC.remove("sourceId");
        MDC.remove("operation");
    }
}
