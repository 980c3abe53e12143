package uk.gegc.aimeter.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.aimeter.features.ai.domain.model.UsageFact;
import uk.gegc.aimeter.features.billing.application.AccountService;
import uk.gegc.aimeter.features.billing.application.BillingContext;
import uk.gegc.aimeter.features.billing.application.BillingLedgerService;
import uk.gegc.aimeter.features.billing.application.BillingMetricsService;
import uk.gegc.aimeter.features.billing.application.BillingProperties;
import uk.gegc.aimeter.features.billing.application.BillingStructuredLogger;
import uk.gegc.aimeter.features.billing.application.ChargeCalculation;
import uk.gegc.aimeter.features.billing.application.ChargeReceiptParams;
import uk.gegc.aimeter.features.billing.application.LlmPricingPolicy;
import uk.gegc.aimeter.features.billing.application.ModelCatalogService;
import uk.gegc.aimeter.features.billing.domain.model.ChargeProvenance;
import uk.gegc.aimeter.features.billing.domain.model.ChargeReason;
import uk.gegc.aimeter.features.billing.domain.model.ReceiptWriteResult;
import uk.gegc.aimeter.features.billing.domain.model.SourceSystem;

import java.math.BigDecimal;

@Slf4j
@Service
@RequiredArgsConstructor
public class BillingLedgerServiceImpl implements BillingLedgerService {

    private static final String UNKNOWN_MODEL = "unknown";

    private final AccountService accountService;
    private final LlmPricingPolicy pricingPolicy;
    private final ModelCatalogService modelCatalogService;
    private final BillingMetricsService metricsService;
    private final BillingProperties billingProperties;

    @Override
    public void commitUsageFact(UsageFact fact, int ordinalIndex) {
        String usageUnitId = fact.usageUnitId();
        if (usageUnitId == null || usageUnitId.isBlank()) {
            log.error("billing.missing_usage_unit_id runId={} model={} callIndex={}",
                    fact.runId(), fact.model(), ordinalIndex);
            metricsService.incrementMissingUsageUnitId(fact.runId());
            usageUnitId = BillingLedgerService.missingUsageUnitId(fact.runId(), ordinalIndex);
        }
        String sourceReference = BillingLedgerService.sourceReference(fact.runId(), fact.attempt(), usageUnitId);
        SourceSystem sourceSystem = fact.source() != null ? fact.source() : SourceSystem.LITELLM;
        String model = fact.model() != null ? fact.model() : UNKNOWN_MODEL;

        try {
            ChargeCalculation charge = price(model, fact.costUsd(), sourceSystem, fact.runId(), sourceReference);

            ChargeReceiptParams params = ChargeReceiptParams.builder()
                    .billingAccountId(fact.billingAccountId())
                    .virtualKeyId(fact.virtualKeyId())
                    .runId(fact.runId())
                    .attempt(fact.attempt())
                    .ingressRequestId(fact.ingressRequestId())
                    .chargedCredits(charge == null ? 0L : charge.chargedCredits())
                    .responseCostUsd(charge == null ? null : charge.userCostUsd())
                    .litellmCallId(sourceSystem == SourceSystem.LITELLM ? fact.usageUnitId() : null)
                    .provenance(ChargeProvenance.STREAM)
                    .chargeReason(ChargeReason.LLM_USAGE)
                    .sourceSystem(sourceSystem)
                    .sourceReference(sourceReference)
                    .build();

            write(params, model, "commitUsageFact");
        } catch (RuntimeException e) {
            log.error("CRITICAL: commitUsageFact failed - user response NOT blocked runId={} sourceReference={}",
                    fact.runId(), sourceReference, e);
            metricsService.incrementLedgerWriteFailure(sourceSystem.wireName());
            if (billingProperties.isRethrowLedgerErrors()) {
                throw e;
            }
        }
    }

    @Override
    public void recordBilling(BillingContext context) {
        String requestId = context.requestId();
        try {
            String model = context.model() != null ? context.model() : UNKNOWN_MODEL;
            String sourceReference = context.litellmCallId();
            if (sourceReference == null || sourceReference.isBlank()) {
                log.error("BUG: LiteLLM response missing call ID - recording charge_receipt without joinable usage reference requestId={} model={}",
                        requestId, model);
                sourceReference = requestId;
            }

            ChargeCalculation charge = price(model, context.providerCostUsd(), SourceSystem.LITELLM, requestId, sourceReference);

            ChargeReceiptParams params = ChargeReceiptParams.builder()
                    .billingAccountId(context.billingAccountId())
                    .virtualKeyId(context.virtualKeyId())
                    .runId(requestId)
                    .attempt(0)
                    .ingressRequestId(requestId)
                    .chargedCredits(charge == null ? 0L : charge.chargedCredits())
                    .responseCostUsd(charge == null ? null : charge.userCostUsd())
                    .litellmCallId(context.litellmCallId())
                    .provenance(context.provenance() != null ? context.provenance() : ChargeProvenance.RESPONSE)
                    .chargeReason(ChargeReason.LLM_USAGE)
                    .sourceSystem(SourceSystem.LITELLM)
                    .sourceReference(sourceReference)
                    .build();

            write(params, model, "recordBilling");
        } catch (RuntimeException e) {
            String provenance = context.provenance() != null ? context.provenance().wireName() : ChargeProvenance.RESPONSE.wireName();
            log.error("CRITICAL: Post-call billing failed ({}) - user response NOT blocked requestId={} accountId={}",
                    provenance, requestId, context.billingAccountId(), e);
            metricsService.incrementLedgerWriteFailure(SourceSystem.LITELLM.wireName());
            if (billingProperties.isRethrowLedgerErrors()) {
                throw e;
            }
        }
    }

    /**
     * @return the charge, or {@code null} when nothing is billable (free model or missing cost)
     */
    private ChargeCalculation price(String model, BigDecimal costUsd, SourceSystem sourceSystem,
                                    String runId, String sourceReference) {
        boolean free = modelCatalogService.isFreeModel(model);
        if (free) {
            log.debug("Free model {}, recording zero-credit receipt sourceReference={}", model, sourceReference);
            return null;
        }
        if (costUsd == null) {
            log.error("CRITICAL: usage missing cost data - billing incomplete (degraded under-billing mode) runId={} model={} sourceReference={}",
                    runId, model, sourceReference);
            metricsService.incrementDegradedBilling(sourceSystem.wireName(), model);
            return null;
        }
        ChargeCalculation charge = pricingPolicy.charge(costUsd);
        log.debug("Cost calculation complete runId={} providerCostUsd={} userCostUsd={} chargedCredits={}",
                runId, costUsd, charge.userCostUsd(), charge.chargedCredits());
        return charge;
    }

    private void write(ChargeReceiptParams params, String model, String operation) {
        ReceiptWriteResult result = accountService.recordChargeReceipt(params);
        String sourceSystem = params.sourceSystem().wireName();
        if (result == ReceiptWriteResult.DUPLICATE) {
            metricsService.incrementReceiptDuplicate(sourceSystem);
            BillingStructuredLogger.logReceipt(log, "info", "{}: charge already recorded",
                    params.billingAccountId(), params.runId(), params.attempt(), sourceSystem,
                    params.sourceReference(), params.chargedCredits(), model, operation);
            return;
        }
        metricsService.incrementReceiptRecorded(sourceSystem, params.chargedCredits());
        BillingStructuredLogger.logReceipt(log, "info", "{}: charge recorded",
                params.billingAccountId(), params.runId(), params.attempt(), sourceSystem,
                params.sourceReference(), params.chargedCredits(), model, operation);
    }
}
