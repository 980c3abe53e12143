package uk.gegc.aimeter.features.billing.application;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Billing configuration (credit conversion, markup and admission heuristics).
 */
@Configuration
@ConfigurationProperties(prefix = "billing")
@Validated
@Data
public class BillingProperties {
    /**
     * Conversion rate: credits granted per 1 USD of value.
     */
    @Positive
    private long creditsPerUsd = 10_000_000L;

    /**
     * Multiplier applied to provider cost to get the user price (strictly greater than 1.0).
     */
    @NotNull
    @DecimalMin(value = "1.0", inclusive = false)
    private BigDecimal markupFactor = new BigDecimal("2.0");

    /**
     * Conservative flat rate used by admission control to price the estimate.
     */
    @NotNull
    @DecimalMin(value = "0.0", inclusive = false)
    private BigDecimal estimatedUsdPer1kTokens = new BigDecimal("0.01");

    /**
     * Completion token ceiling assumed by admission control for every request.
     */
    @Positive
    private int maxCompletionTokens = 2048;

    /**
     * Characters per token used to estimate prompt tokens.
     */
    @Positive
    private int charsPerToken = 4;

    /**
     * When true, ledger write failures are rethrown instead of only logged.
     * Enabled in the test profile so that silent billing breakage fails the suite.
     */
    private boolean rethrowLedgerErrors = false;

    /**
     * Window used by the activity report when the caller gives no {@code from}.
     */
    @Positive
    private int activityDefaultRangeDays = 30;

    /**
     * Widest window the activity report accepts.
     */
    @Positive
    private int activityMaxRangeDays = 90;

    /**
     * Widest window the activity report accepts with hourly buckets.
     */
    @Positive
    private int activityMaxHourlyRangeDays = 7;

    @Positive
    private int activityMaxPageSize = 100;
}
