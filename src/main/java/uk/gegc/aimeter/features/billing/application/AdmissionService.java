package uk.gegc.aimeter.features.billing.application;

import uk.gegc.aimeter.features.ai.domain.model.CallerIdentity;
import uk.gegc.aimeter.features.ai.domain.model.ChatMessage;
import uk.gegc.aimeter.features.billing.domain.exception.InsufficientCreditsException;

import java.util.List;

/**
 * Pre-flight cost check against the caller's cached balance.
 * <p>
 * Advisory: no hold or reservation is taken, so concurrent requests can pass against the same
 * snapshot. The ledger stays correct either way.
 */
public interface AdmissionService {

    /**
     * @throws InsufficientCreditsException when the estimate exceeds the cached balance
     */
    AdmissionDecision admit(List<ChatMessage> messages, CallerIdentity caller);

    long estimatePromptTokens(List<ChatMessage> messages);
}
