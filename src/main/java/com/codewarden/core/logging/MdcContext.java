package com.codewarden.core.logging;

import com.codewarden.core.model.ChangeType;
import org.slf4j.MDC;

/**
 * Utility for managing Codewarden-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setFile(String filePath, ChangeType changeType) {
        MDC.put("filePath", filePath);
        if (changeType != null) {
            MDC.put("changeType", changeType.wireName());
        }
    }

    public static void setSession(String sessionId) {
        MDC.put("sessionId", sessionId);
    }

    public static void clear() {
        MDC.remove("filePath");
        MDC.remove("changeType");
        MDC.remove("sessionId");
    }
}
