package uk.gegc.aimeter.features.billing.application;

import uk.gegc.aimeter.features.ai.domain.model.UsageFact;

/**
 * Sole writer of charge receipts.
 * <p>
 * Both entry points record exactly one receipt per unit of work, including zero-credit units,
 * and never propagate failures to the caller unless {@code billing.rethrow-ledger-errors} is set.
 */
public interface BillingLedgerService {

    /**
     * Commits one usage fact from a streamed run.
     *
     * @param ordinalIndex per-run index assigned by the relay, used for the fallback usage unit id
     */
    void commitUsageFact(UsageFact fact, int ordinalIndex);

    /**
     * Records billing for a single-shot completion.
     */
    void recordBilling(BillingContext context);

    static String sourceReference(String runId, int attempt, String usageUnitId) {
        return runId + "/" + attempt + "/" + usageUnitId;
    }

    static String missingUsageUnitId(String runId, int ordinalIndex) {
        return "MISSING:" + runId + "/" + ordinalIndex;
    }
}
