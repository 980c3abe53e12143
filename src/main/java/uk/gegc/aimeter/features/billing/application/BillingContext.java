package uk.gegc.aimeter.features.billing.application;

import uk.gegc.aimeter.features.billing.domain.model.ChargeProvenance;

import java.math.BigDecimal;

/**
 * Billing input for a single-shot completion.
 *
 * @param providerCostUsd {@code null} when the provider did not report a cost
 * @param litellmCallId   provider call id, {@code null} when absent
 */
public record BillingContext(
        String billingAccountId,
        String virtualKeyId,
        String requestId,
        String model,
        BigDecimal providerCostUsd,
        String litellmCallId,
        ChargeProvenance provenance
) {
}
