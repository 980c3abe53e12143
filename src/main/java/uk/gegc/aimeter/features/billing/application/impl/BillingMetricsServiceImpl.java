package uk.gegc.aimeter.features.billing.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.aimeter.features.billing.application.BillingMetricsService;

/**
 * Micrometer-backed billing metrics.
 */
@Slf4j
@Service
public class BillingMetricsServiceImpl implements BillingMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter receiptsRecordedCounter;
    private final Counter creditsChargedCounter;
    private final Counter receiptsDuplicateCounter;
    private final Counter degradedBillingCounter;
    private final Counter missingUsageUnitIdCounter;
    private final Counter ledgerWriteFailureCounter;
    private final Counter admissionRejectedCounter;

    public BillingMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.receiptsRecordedCounter = Counter.builder("billing.receipts.recorded")
                .description("Number of charge receipts written")
                .register(meterRegistry);
        this.creditsChargedCounter = Counter.builder("billing.credits.charged")
                .description("Credits charged through newly written receipts")
                .register(meterRegistry);
        this.receiptsDuplicateCounter = Counter.builder("billing.receipts.duplicate")
                .description("Number of receipt writes skipped as already recorded")
                .register(meterRegistry);
        this.degradedBillingCounter = Counter.builder("billing.receipts.degraded")
                .description("Number of paid usage units recorded without cost data")
                .register(meterRegistry);
        this.missingUsageUnitIdCounter = Counter.builder("billing.usage.missing_unit_id")
                .description("Number of usage facts without an adapter usage unit id")
                .register(meterRegistry);
        this.ledgerWriteFailureCounter = Counter.builder("billing.receipts.failed")
                .description("Number of failed receipt writes")
                .register(meterRegistry);
        this.admissionRejectedCounter = Counter.builder("billing.admission.rejected")
                .description("Number of requests rejected by admission control")
                .register(meterRegistry);
    }

    @Override
    public void incrementReceiptRecorded(String sourceSystem, long chargedCredits) {
        log.info("METRIC: billing.receipts.recorded sourceSystem={} chargedCredits={}", sourceSystem, chargedCredits);
        receiptsRecordedCounter.increment();
        creditsChargedCounter.increment(chargedCredits);
    }

    @Override
    public void incrementReceiptDuplicate(String sourceSystem) {
        log.info("METRIC: billing.receipts.duplicate sourceSystem={}", sourceSystem);
        receiptsDuplicateCounter.increment();
    }

    @Override
    public void incrementDegradedBilling(String sourceSystem, String model) {
        log.info("METRIC: billing.receipts.degraded sourceSystem={} model={}", sourceSystem, model);
        degradedBillingCounter.increment();
    }

    @Override
    public void incrementMissingUsageUnitId(String runId) {
        log.info("METRIC: billing.usage.missing_unit_id runId={}", runId);
        missingUsageUnitIdCounter.increment();
    }

    @Override
    public void incrementLedgerWriteFailure(String sourceSystem) {
        log.info("METRIC: billing.receipts.failed sourceSystem={}", sourceSystem);
        ledgerWriteFailureCounter.increment();
    }

    @Override
    public void incrementAdmissionRejected(String billingAccountId, long requiredCredits) {
        log.info("METRIC: billing.admission.rejected accountId={} requiredCredits={}", billingAccountId, requiredCredits);
        admissionRejectedCounter.increment();
    }

    @Override
    public void incrementRunOutcome(String outcome) {
        log.info("METRIC: ai.runs.completed outcome={}", outcome);
        Counter.builder("ai.runs.completed")
                .description("Number of relayed runs by terminal outcome")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }
}
