package com.agentide.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setComponent puts session, component and step in MDC")
    void setComponent() {
        MdcContext.setComponent("AIDE-2026-0001", "write_worker", 2);

        assertEquals("AIDE-2026-0001", MDC.get("sessionId"));
        assertEquals("write_worker", MDC.get("component"));
        assertEquals("2", MDC.get("stepIndex"));
    }

    @Test
    @DisplayName("clearComponent keeps the session id")
    void clearComponent() {
        MdcContext.setComponent("AIDE-2026-0001", "plan_controller", 0);

        MdcContext.clearComponent();

        assertEquals("AIDE-2026-0001", MDC.get("sessionId"));
        assertNull(MDC.get("component"));
        assertNull(MDC.get("stepIndex"));
    }

    @Test
    @DisplayName("clear removes every key")
    void clear() {
        MdcContext.setSession("AIDE-2026-0001");

        MdcContext.clear();

        assertNull(MDC.get("sessionId"));
    }
}
