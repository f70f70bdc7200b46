package com.agrigrid.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Agrigrid-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTick(long tick) {
        MDC.put("tick", String.valueOf(tick));
    }

    public static void setTask(long tick, String taskId, String agentType) {
        MDC.put("tick", String.valueOf(tick));
        MDC.put("taskId", taskId);
        MDC.put("agentType", agentType);
    }

    public static void clearTask() {
        MDC.remove("taskId");
        MDC.remove("agentType");
    }

    public static void clear() {
        MDC.remove("tick");
        MDC.remove("taskId");
        MDC.remove("agentType");
    }
}
