package uk.gegc.aimeter.features.ai.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.aimeter.features.ai.application.ChatCompletionService;
import uk.gegc.aimeter.features.ai.application.ConversationPolicy;
import uk.gegc.aimeter.features.ai.application.LlmCompletionPort;
import uk.gegc.aimeter.features.ai.domain.model.CallerIdentity;
import uk.gegc.aimeter.features.ai.domain.model.ChatCompletion;
import uk.gegc.aimeter.features.ai.domain.model.ChatMessage;
import uk.gegc.aimeter.features.ai.domain.model.ChatRunRequest;
import uk.gegc.aimeter.features.ai.domain.model.LlmCompletionRequest;
import uk.gegc.aimeter.features.ai.domain.model.LlmCompletionResult;
import uk.gegc.aimeter.features.billing.application.AdmissionService;
import uk.gegc.aimeter.features.billing.application.BillingContext;
import uk.gegc.aimeter.features.billing.application.BillingLedgerService;
import uk.gegc.aimeter.features.billing.application.ModelCatalogService;
import uk.gegc.aimeter.features.billing.domain.model.ChargeProvenance;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ChatCompletionServiceImpl implements ChatCompletionService {

    private final ConversationPolicy conversationPolicy;
    private final AdmissionService admissionService;
    private final LlmCompletionPort completionPort;
    private final BillingLedgerService billingLedgerService;
    private final ModelCatalogService modelCatalogService;

    @Override
    public ChatCompletion complete(ChatRunRequest request, CallerIdentity caller) {
        List<ChatMessage> messages = conversationPolicy.prepare(request.messages());
        admissionService.admit(messages, caller);

        String model = modelCatalogService.resolveModel(request.model());
        LlmCompletionResult result = completionPort.completion(new LlmCompletionRequest(model, messages, caller));

        if (result.providerCostUsd() != null && result.providerCostUsd().signum() == 0
                && !modelCatalogService.isFreeModel(result.model())) {
            log.warn("Zero provider cost reported for paid model {} requestId={}", result.model(), caller.requestId());
        }

        billingLedgerService.recordBilling(new BillingContext(
                caller.billingAccountId(),
                caller.virtualKeyId(),
                caller.requestId(),
                result.model(),
                result.providerCostUsd(),
                result.litellmCallId(),
                ChargeProvenance.RESPONSE));

        return new ChatCompletion(caller.requestId(), result.content(), result.model(),
                result.finishReason(), result.usage());
    }
}
