package com.appforge.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void setGenerationPutsGenerationId() {
        MdcContext.setGeneration("GEN-2026-ABCDEF01");
        assertEquals("GEN-2026-ABCDEF01", MDC.get("generationId"));
    }

    @Test
    void setTaskPutsAllTaskKeys() {
        MdcContext.setTask("GEN-1", "auth", "auth");
        assertEquals("GEN-1", MDC.get("generationId"));
        assertEquals("auth", MDC.get("taskId"));
        assertEquals("auth", MDC.get("taskKind"));
    }

    @Test
    void nullProviderRemovesKey() {
        MdcContext.setProvider("openai");
        assertEquals("openai", MDC.get("provider"));
        MdcContext.setProvider(null);
        assertNull(MDC.get("provider"));
    }

    @Test
    void clearRemovesOnlyAppforgeKeys() {
        MDC.put("requestId", "r-1");
        MdcContext.setTask("GEN-1", "backend", "backend");
        MdcContext.setProvider("anthropic");

        MdcContext.clear();

        assertNull(MDC.get("generationId"));
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("taskKind"));
        assertNull(MDC.get("provider"));
        assertEquals("r-1", MDC.get("requestId"));
    }
}
