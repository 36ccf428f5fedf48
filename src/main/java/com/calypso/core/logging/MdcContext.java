package com.calypso.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Calypso-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setProject(String projectId) {
        MDC.put("projectId", projectId);
    }

    public static void setBuild(String projectId, String buildId) {
        MDC.put("projectId", projectId);
        MDC.put("buildId", buildId);
    }

    public static void clear() {
        MDC.remove("projectId");
        MDC.remove("buildId");
    }
}
