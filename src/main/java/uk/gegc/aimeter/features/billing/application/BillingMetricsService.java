package uk.gegc.aimeter.features.billing.application;

/**
 * Service for emitting billing and relay metrics.
 */
public interface BillingMetricsService {

    /**
     * Ledger counters.
     */
    void incrementReceiptRecorded(String sourceSystem, long chargedCredits);
    void incrementReceiptDuplicate(String sourceSystem);
    void incrementDegradedBilling(String sourceSystem, String model);
    void incrementMissingUsageUnitId(String runId);
    void incrementLedgerWriteFailure(String sourceSystem);

    /**
     * Admission counters.
     */
    void incrementAdmissionRejected(String billingAccountId, long requiredCredits);

    /**
     * Relay outcome per run (succeeded, failed, aborted).
     */
    void incrementRunOutcome(String outcome);
}
