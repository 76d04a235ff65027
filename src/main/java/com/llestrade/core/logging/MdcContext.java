package com.llestrade.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing the engine's MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setJob(String jobId, String groupId, String jobKind) {
        MDC.put("jobId", jobId);
        if (groupId != null) {
            MDC.put("groupId", groupId);
        }
        MDC.put("jobKind", jobKind);
    }

    public static void setDocument(String document) {
        MDC.put("document", document);
    }

    public static void clearDocument() {
        MDC.remove("document");
    }

    public static void clear() {
        MDC.remove("jobId");
        MDC.remove("groupId");
        MDC.remove("jobKind");
        MDC.remove("document");
    }
}
