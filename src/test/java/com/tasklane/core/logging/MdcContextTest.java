package com.tasklane.core.logging;

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
    @DisplayName("setRun puts taskListId and runId in MDC")
    void setRun() {
        MdcContext.setRun("web-app", "run-1a2b");
        assertEquals("web-app", MDC.get("taskListId"));
        assertEquals("run-1a2b", MDC.get("runId"));
    }

    @Test
    @DisplayName("setWave puts runId and waveNumber in MDC")
    void setWave() {
        MdcContext.setWave("run-1a2b", 3);
        assertEquals("run-1a2b", MDC.get("runId"));
        assertEquals("3", MDC.get("waveNumber"));
    }

    @Test
    @DisplayName("clearWorker keeps run keys")
    void clearWorker() {
        MdcContext.setWorker("run-1a2b", "create-api", "worker-9");
        MdcContext.clearWorker();
        assertEquals("run-1a2b", MDC.get("runId"));
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("workerId"));
    }

    @Test
    @DisplayName("clear removes all tasklane MDC keys")
    void clear() {
        MdcContext.setRun("web-app", "run-1a2b");
        MdcContext.setWave("run-1a2b", 2);
        MdcContext.setWorker("run-1a2b", "create-api", "worker-9");
        MdcContext.clear();
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("taskListId"));
        assertNull(MDC.get("waveNumber"));
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("workerId"));
    }
}
