package uk.gegc.aimeter.features.ai.domain.model;

import java.math.BigDecimal;

/**
 * @param providerCostUsd cost reported by the proxy, {@code null} when missing
 * @param litellmCallId   proxy call id, {@code null} when missing
 */
public record LlmCompletionResult(
        String content,
        String model,
        String finishReason,
        TokenUsage usage,
        BigDecimal providerCostUsd,
        String litellmCallId
) {
}
