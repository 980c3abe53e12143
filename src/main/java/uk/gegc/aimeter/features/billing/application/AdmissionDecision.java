package uk.gegc.aimeter.features.billing.application;

import java.math.BigDecimal;

/**
 * Result of a passed admission check.
 */
public record AdmissionDecision(
        long estimatedTokens,
        BigDecimal estimatedCostUsd,
        long requiredCredits,
        long availableCredits
) {
}
