package uk.gegc.aimeter.features.billing.application;

import java.math.BigDecimal;

/**
 * @param chargedCredits      credits debited from the caller, rounded up
 * @param userCostUsd         user-facing price in USD (provider cost times markup)
 * @param providerCostCredits provider cost expressed in credits, rounded up
 */
public record ChargeCalculation(long chargedCredits, BigDecimal userCostUsd, long providerCostCredits) {

    public static final ChargeCalculation ZERO = new ChargeCalculation(0L, BigDecimal.ZERO, 0L);
}
