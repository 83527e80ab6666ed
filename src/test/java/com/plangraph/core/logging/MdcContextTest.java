package com.plangraph.core.logging;

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
    void setsPlanKeys() {
        MdcContext.setPlanSource("plans/q3.xml");
        MdcContext.setPlanVersion("2.1");
        assertEquals("plans/q3.xml", MDC.get("planSource"));
        assertEquals("2.1", MDC.get("planVersion"));
    }

    @Test
    void clearLeavesOtherKeys() {
        MDC.put("requestId", "r-1");
        MdcContext.setPlanSource("a.xml");
        MdcContext.setPlanVersion("1.0");

        MdcContext.clear();

        assertNull(MDC.get("planSource"));
        assertNull(MDC.get("planVersion"));
        assertEquals("r-1", MDC.get("requestId"));
    }
}
