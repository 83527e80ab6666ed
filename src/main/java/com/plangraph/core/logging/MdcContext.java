package com.plangraph.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing plangraph-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setPlanSource(String source) {
        MDC.put("planSource", source);
    }

    public static void setPlanVersion(String version) {
        MDC.put("planVersion", version);
    }

    public static void clear() {
        MDC.remove("planSource");
        MDC.remove("planVersion");
    }
}
