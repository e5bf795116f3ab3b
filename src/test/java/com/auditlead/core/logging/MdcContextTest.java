package com.auditlead.core.logging;

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
    @DisplayName("setRun puts runId in MDC")
    void setRun() {
        MdcContext.setRun("AUD-2026-0001");
        assertEquals("AUD-2026-0001", MDC.get("runId"));
    }

    @Test
    @DisplayName("setAgent puts runId, agentName and phase in MDC")
    void setAgent() {
        MdcContext.setAgent("AUD-2026-0001", "seo", "Analysis");
        assertEquals("AUD-2026-0001", MDC.get("runId"));
        assertEquals("seo", MDC.get("agentName"));
        assertEquals("Analysis", MDC.get("phase"));
    }

    @Test
    @DisplayName("clearPhase keeps the run id")
    void clearPhase() {
        MdcContext.setPhase("AUD-2026-0001", "Crawling");
        MdcContext.clearPhase();
        assertNull(MDC.get("phase"));
        assertEquals("AUD-2026-0001", MDC.get("runId"));
    }

    @Test
    @DisplayName("clear removes all audit keys")
    void clear() {
        MdcContext.setAgent("AUD-2026-0001", "seo", "Analysis");
        MdcContext.clear();
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("agentName"));
        assertNull(MDC.get("phase"));
    }

    @Test
    @DisplayName("clear does not remove unrelated MDC keys")
    void clearPreservesOtherKeys() {
        MDC.put("requestId", "abc");
        MdcContext.setRun("AUD-2026-0001");
        MdcContext.clear();
        assertEquals("abc", MDC.get("requestId"));
        MDC.remove("requestId");
    }
}
