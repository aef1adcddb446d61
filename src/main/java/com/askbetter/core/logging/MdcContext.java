package com.askbetter.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing AskBetter-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setReview(String reviewId) {
        MDC.put("reviewId", reviewId);
    }

    public static void setAttempt(String reviewId, int attempt) {
        MDC.put("reviewId", reviewId);
        MDC.put("attempt", String.valueOf(attempt));
    }

    public static void clear() {
        MDC.remove("reviewId");
        MDC.remove("attempt");
    }
}
