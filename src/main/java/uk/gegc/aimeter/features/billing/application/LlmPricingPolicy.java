package uk.gegc.aimeter.features.billing.application;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Converts provider cost into charged credits.
 * <p>
 * {@code chargedCredits = ceil(providerCostUsd * creditsPerUsd * markupFactor)}. With a markup of at
 * least 1.0 and upward rounding, the charged credits never fall below the provider cost in credits.
 */
@Component
public class LlmPricingPolicy {

    private final BigDecimal creditsPerUsd;
    private final BigDecimal markupFactor;

    @Autowired
    public LlmPricingPolicy(BillingProperties billingProperties) {
        this(billingProperties.getCreditsPerUsd(), billingProperties.getMarkupFactor());
    }

    public LlmPricingPolicy(long creditsPerUsd, BigDecimal markupFactor) {
        if (creditsPerUsd <= 0) {
            throw new IllegalArgumentException("creditsPerUsd must be positive, got " + creditsPerUsd);
        }
        if (markupFactor == null || markupFactor.compareTo(BigDecimal.ONE) < 0) {
            throw new IllegalArgumentException("markupFactor must be >= 1.0, got " + markupFactor);
        }
        this.creditsPerUsd = BigDecimal.valueOf(creditsPerUsd);
        this.markupFactor = markupFactor;
    }

    public ChargeCalculation charge(BigDecimal providerCostUsd) {
        if (providerCostUsd == null || providerCostUsd.signum() <= 0) {
            return ChargeCalculation.ZERO;
        }
        BigDecimal providerCredits = providerCostUsd.multiply(creditsPerUsd);
        long chargedCredits = toCreditsCeil(providerCredits.multiply(markupFactor));
        BigDecimal userCostUsd = providerCostUsd.multiply(markupFactor);
        return new ChargeCalculation(chargedCredits, userCostUsd, toCreditsCeil(providerCredits));
    }

    private static long toCreditsCeil(BigDecimal credits) {
        return credits.setScale(0, RoundingMode.CEILING).longValueExact();
    }
}
