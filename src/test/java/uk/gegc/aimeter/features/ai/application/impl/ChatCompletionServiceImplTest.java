package uk.gegc.aimeter.features.ai.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.aimeter.features.ai.application.ConversationPolicy;
import uk.gegc.aimeter.features.ai.application.LlmCompletionPort;
import uk.gegc.aimeter.features.ai.domain.model.CallerIdentity;
import uk.gegc.aimeter.features.ai.domain.model.ChatCompletion;
import uk.gegc.aimeter.features.ai.domain.model.ChatMessage;
import uk.gegc.aimeter.features.ai.domain.model.ChatRunRequest;
import uk.gegc.aimeter.features.ai.domain.model.LlmCompletionRequest;
import uk.gegc.aimeter.features.ai.domain.model.LlmCompletionResult;
import uk.gegc.aimeter.features.ai.domain.model.TokenUsage;
import uk.gegc.aimeter.features.billing.application.AdmissionService;
import uk.gegc.aimeter.features.billing.application.BillingContext;
import uk.gegc.aimeter.features.billing.application.BillingLedgerService;
import uk.gegc.aimeter.features.billing.application.ModelCatalogService;
import uk.gegc.aimeter.features.billing.domain.model.ChargeProvenance;
import uk.gegc.aimeter.shared.exception.AiServiceException;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChatCompletionServiceImplTest {

    private static final CallerIdentity CALLER = new CallerIdentity("acct-1", "vk-1", "req-1", "trace-1");
    private static final List<ChatMessage> MESSAGES = List.of(ChatMessage.user("hi"));

    @Mock
    private ConversationPolicy conversationPolicy;

    @Mock
    private AdmissionService admissionService;

    @Mock
    private LlmCompletionPort completionPort;

    @Mock
    private BillingLedgerService billingLedgerService;

    @Mock
    private ModelCatalogService modelCatalogService;

    private ChatCompletionServiceImpl service;

    @BeforeEach
    void setUp() {
        service = new ChatCompletionServiceImpl(conversationPolicy, admissionService, completionPort,
                billingLedgerService, modelCatalogService);
        when(conversationPolicy.prepare(MESSAGES)).thenReturn(MESSAGES);
    }

    @Test
    @DisplayName("Completes and records billing with the proxy cost and call id")
    void completesAndBills() {
        when(modelCatalogService.resolveModel(null)).thenReturn("gpt-4o-mini");
        when(completionPort.completion(any())).thenReturn(new LlmCompletionResult("Hello!", "gpt-4o-mini", "stop",
                new TokenUsage(12, 3), new BigDecimal("0.0004"), "call-9"));

        ChatCompletion completion = service.complete(new ChatRunRequest(null, null, MESSAGES), CALLER);

        assertThat(completion.content()).isEqualTo("Hello!");
        assertThat(completion.requestId()).isEqualTo("req-1");
        assertThat(completion.usage()).isEqualTo(new TokenUsage(12, 3));

        ArgumentCaptor<LlmCompletionRequest> request = ArgumentCaptor.forClass(LlmCompletionRequest.class);
        verify(completionPort).completion(request.capture());
        assertThat(request.getValue().model()).isEqualTo("gpt-4o-mini");
        assertThat(request.getValue().caller()).isEqualTo(CALLER);

        ArgumentCaptor<BillingContext> billing = ArgumentCaptor.forClass(BillingContext.class);
        verify(billingLedgerService).recordBilling(billing.capture());
        assertThat(billing.getValue().litellmCallId()).isEqualTo("call-9");
        assertThat(billing.getValue().providerCostUsd()).isEqualByComparingTo("0.0004");
        assertThat(billing.getValue().provenance()).isEqualTo(ChargeProvenance.RESPONSE);
        assertThat(billing.getValue().requestId()).isEqualTo("req-1");
    }

    @Test
    @DisplayName("Provider failure propagates and nothing is billed")
    void providerFailureNotBilled() {
        when(modelCatalogService.resolveModel("gpt-4o")).thenReturn("gpt-4o");
        when(completionPort.completion(any())).thenThrow(new AiServiceException("LiteLLM API error: 502"));

        assertThatThrownBy(() -> service.complete(new ChatRunRequest(null, "gpt-4o", MESSAGES), CALLER))
                .isInstanceOf(AiServiceException.class);
        verifyNoInteractions(billingLedgerService);
    }
}
