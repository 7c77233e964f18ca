package com.agentide.core.logging;

import org.slf4j.MDC;

/**
 * Manages the MDC keys printed by the log pattern.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put("sessionId", sessionId);
    }

    public static void setComponent(String sessionId, String component, int stepIndex) {
        MDC.put("sessionId", sessionId);
        MDC.put("component", component);
        MDC.put("stepIndex", String.valueOf(stepIndex));
    }

    public static void clearComponent() {
        MDC.remove("component");
        MDC.remove("stepIndex");
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("component");
        MDC.remove("stepIndex");
    }
}
