package uk.gegc.aimeter.features.ai.domain.model;

import uk.gegc.aimeter.features.billing.domain.model.SourceSystem;

import java.math.BigDecimal;

/**
 * One billable unit of provider usage, reported inside a {@code usage_report} event.
 *
 * @param costUsd     provider-reported cost, {@code null} when the provider did not report one
 * @param usageUnitId adapter-assigned id of the billable unit (typically the LLM call id), may be {@code null}
 */
public record UsageFact(
        String runId,
        int attempt,
        String billingAccountId,
        String virtualKeyId,
        String ingressRequestId,
        SourceSystem source,
        String model,
        BigDecimal costUsd,
        String usageUnitId,
        Integer inputTokens,
        Integer outputTokens
) {
}
