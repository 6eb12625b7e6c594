package com.ashby.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Ashby-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setCapability(String capability) {
        MDC.put("capability", capability);
    }

    public static void setStage(String capability, String stage) {
        MDC.put("capability", capability);
        MDC.put("stage", stage);
    }

    public static void setProcess(String processId) {
        MDC.put("processId", processId);
    }

    public static void clear() {
        MDC.remove("capability");
        MDC.remove("stage");
        MDC.remove("processId");
    }
}
