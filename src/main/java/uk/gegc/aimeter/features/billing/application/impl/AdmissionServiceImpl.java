package uk.gegc.aimeter.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.aimeter.features.ai.domain.model.CallerIdentity;
import uk.gegc.aimeter.features.ai.domain.model.ChatMessage;
import uk.gegc.aimeter.features.billing.application.AccountService;
import uk.gegc.aimeter.features.billing.application.AdmissionDecision;
import uk.gegc.aimeter.features.billing.application.AdmissionService;
import uk.gegc.aimeter.features.billing.application.BillingMetricsService;
import uk.gegc.aimeter.features.billing.application.BillingProperties;
import uk.gegc.aimeter.features.billing.application.BillingStructuredLogger;
import uk.gegc.aimeter.features.billing.application.LlmPricingPolicy;
import uk.gegc.aimeter.features.billing.domain.exception.InsufficientCreditsException;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class AdmissionServiceImpl implements AdmissionService {

    private static final BigDecimal ONE_THOUSAND = BigDecimal.valueOf(1000);

    private final AccountService accountService;
    private final LlmPricingPolicy pricingPolicy;
    private final BillingProperties billingProperties;
    private final BillingMetricsService metricsService;

    @Override
    public AdmissionDecision admit(List<ChatMessage> messages, CallerIdentity caller) {
        long estimatedTokens = estimatePromptTokens(messages) + billingProperties.getMaxCompletionTokens();
        BigDecimal estimatedCostUsd = BigDecimal.valueOf(estimatedTokens)
                .multiply(billingProperties.getEstimatedUsdPer1kTokens())
                .divide(ONE_THOUSAND, MathContext.DECIMAL64);
        long requiredCredits = pricingPolicy.charge(estimatedCostUsd).chargedCredits();
        long availableCredits = accountService.getBalance(caller.billingAccountId());

        if (requiredCredits > availableCredits) {
            BillingStructuredLogger.logAdmission(log, "warn",
                    "Admission rejected: estimated {} tokens exceeds balance",
                    caller.billingAccountId(), caller.requestId(), requiredCredits, availableCredits, estimatedTokens);
            metricsService.incrementAdmissionRejected(caller.billingAccountId(), requiredCredits);
            throw new InsufficientCreditsException(caller.billingAccountId(), requiredCredits, availableCredits);
        }

        log.debug("Admission passed accountId={} estimatedTokens={} requiredCredits={} availableCredits={}",
                caller.billingAccountId(), estimatedTokens, requiredCredits, availableCredits);
        return new AdmissionDecision(estimatedTokens, estimatedCostUsd, requiredCredits, availableCredits);
    }

    @Override
    public long estimatePromptTokens(List<ChatMessage> messages) {
        long totalChars = messages == null ? 0L : messages.stream().mapToLong(ChatMessage::length).sum();
        long charsPerToken = billingProperties.getCharsPerToken();
        return (totalChars + charsPerToken - 1) / charsPerToken;
    }
}
