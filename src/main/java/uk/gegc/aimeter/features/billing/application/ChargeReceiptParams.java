package uk.gegc.aimeter.features.billing.application;

import lombok.Builder;
import uk.gegc.aimeter.features.billing.domain.model.ChargeProvenance;
import uk.gegc.aimeter.features.billing.domain.model.ChargeReason;
import uk.gegc.aimeter.features.billing.domain.model.SourceSystem;

import java.math.BigDecimal;

/**
 * Receipt to persist. {@code (sourceSystem, sourceReference)} is the idempotency key.
 */
@Builder(toBuilder = true)
public record ChargeReceiptParams(
        String billingAccountId,
        String virtualKeyId,
        String runId,
        int attempt,
        String ingressRequestId,
        long chargedCredits,
        BigDecimal responseCostUsd,
        String litellmCallId,
        ChargeProvenance provenance,
        ChargeReason chargeReason,
        SourceSystem sourceSystem,
        String sourceReference
) {
}
