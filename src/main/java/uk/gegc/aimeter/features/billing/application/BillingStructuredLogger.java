package uk.gegc.aimeter.features.billing.application;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Structured logging utility for billing operations.
 * Puts the receipt fields into MDC for the duration of one log call.
 */
public final class BillingStructuredLogger {

    private BillingStructuredLogger() {
    }

    /**
     * Log a receipt write (or attempted write) with structured fields.
     */
    public static void logReceipt(Logger logger, String level, String message,
            String billingAccountId, String runId, int attempt, String sourceSystem,
            String sourceReference, long chargedCredits, String model, Object... additionalArgs) {

        MDC.put("billing.accountId", billingAccountId);
        MDC.put("billing.runId", runId);
        MDC.put("billing.attempt", String.valueOf(attempt));
        MDC.put("billing.sourceSystem", sourceSystem);
        MDC.put("billing.sourceReference", sourceReference);
        MDC.put("billing.chargedCredits", String.valueOf(chargedCredits));
        MDC.put("billing.model", model);

        try {
            log(logger, level, message, additionalArgs);
        } finally {
            clearBillingMDC();
        }
    }

    /**
     * Log an admission decision.
     */
    public static void logAdmission(Logger logger, String level, String message,
            String billingAccountId, String requestId, long requiredCredits, long availableCredits,
            Object... additionalArgs) {

        MDC.put("billing.accountId", billingAccountId);
        MDC.put("billing.requestId", requestId);
        MDC.put("billing.requiredCredits", String.valueOf(requiredCredits));
        MDC.put("billing.availableCredits", String.valueOf(availableCredits));

        try {
            log(logger, level, message, additionalArgs);
        } finally {
            clearBillingMDC();
        }
    }

    /**
     * Clear billing-specific MDC context.
     */
    public static void clearBillingMDC() {
        MDC.remove("billing.accountId");
        MDC.remove("billing.runId");
        MDC.remove("billing.attempt");
        MDC.remove("billing.sourceSystem");
        MDC.remove("billing.sourceReference");
        MDC.remove("billing.chargedCredits");
        MDC.remove("billing.model");
        MDC.remove("billing.requestId");
        MDC.remove("billing.requiredCredits");
        MDC.remove("billing.availableCredits");
    }

    private static void log(Logger logger, String level, String message, Object... args) {
        switch (level.toLowerCase()) {
            case "warn" -> logger.warn(message, args);
            case "error" -> logger.error(message, args);
            case "debug" -> logger.debug(message, args);
            default -> logger.info(message, args);
        }
    }
}
