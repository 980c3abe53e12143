package uk.gegc.aimeter.features.ai.infra.provider;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Answers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.metadata.ChatResponseMetadata;
import org.springframework.ai.chat.metadata.DefaultUsage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import reactor.core.publisher.Flux;
import uk.gegc.aimeter.features.ai.domain.event.AiEvent;
import uk.gegc.aimeter.features.ai.domain.event.AssistantFinalEvent;
import uk.gegc.aimeter.features.ai.domain.event.ErrorEvent;
import uk.gegc.aimeter.features.ai.domain.event.UsageReportEvent;
import uk.gegc.aimeter.features.ai.domain.model.AbortSignal;
import uk.gegc.aimeter.features.ai.domain.model.CallerIdentity;
import uk.gegc.aimeter.features.ai.domain.model.ChatMessage;
import uk.gegc.aimeter.features.ai.domain.model.GraphErrorCode;
import uk.gegc.aimeter.features.ai.domain.model.GraphRunRequest;
import uk.gegc.aimeter.features.ai.domain.model.GraphRunResult;
import uk.gegc.aimeter.features.ai.domain.model.UsageFact;
import uk.gegc.aimeter.features.billing.application.ModelCatalogService;
import uk.gegc.aimeter.features.billing.domain.model.SourceSystem;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SpringAiChatGraphProviderTest {

    @Mock(answer = Answers.RETURNS_DEEP_STUBS)
    private ChatClient chatClient;

    @Mock
    private ModelCatalogService modelCatalogService;

    private SpringAiChatGraphProvider provider;

    @BeforeEach
    void setUp() {
        provider = new SpringAiChatGraphProvider(chatClient, modelCatalogService);
        when(modelCatalogService.resolveModel(null)).thenReturn("gpt-4o-mini");
    }

    private static GraphRunRequest request(AbortSignal abortSignal) {
        return new GraphRunRequest("r1", "req-1", "springai:chat", List.of(ChatMessage.user("hi")), null,
                new CallerIdentity("acct-1", "vk-1", "req-1", "req-1"), abortSignal);
    }

    private static ChatResponse chunk(String text, Integer promptTokens, Integer completionTokens) {
        ChatResponseMetadata.Builder metadata = ChatResponseMetadata.builder().id("chatcmpl-1");
        if (promptTokens != null) {
            metadata.usage(new DefaultUsage(promptTokens, completionTokens));
        }
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))), metadata.build());
    }

    private void streamReturns(Flux<ChatResponse> flux) {
        when(chatClient.prompt().messages(anyList()).options(any()).stream().chatResponse()).thenReturn(flux);
    }

    @Test
    @DisplayName("Streams deltas, then usage priced from the catalog, final and done")
    void streamsAndReportsUsage() {
        streamReturns(Flux.just(chunk("Hel", null, null), chunk("lo", null, null), chunk("", 10, 4)));
        when(modelCatalogService.estimateCostUsd("gpt-4o-mini", 10, 4)).thenReturn(Optional.of(new BigDecimal("0.00001")));

        GraphRunResult result = provider.runGraph(request(new AbortSignal()));
        List<AiEvent> events = result.stream().toList();

        assertThat(events).extracting(AiEvent::type)
                .containsExactly("text_delta", "text_delta", "usage_report", "assistant_final", "done");
        UsageFact fact = ((UsageReportEvent) events.get(2)).fact();
        assertThat(fact.source()).isEqualTo(SourceSystem.SPRING_AI);
        assertThat(fact.usageUnitId()).isEqualTo("chatcmpl-1");
        assertThat(fact.costUsd()).isEqualByComparingTo("0.00001");
        assertThat(fact.inputTokens()).isEqualTo(10);
        assertThat(fact.outputTokens()).isEqualTo(4);
        assertThat(((AssistantFinalEvent) events.get(3)).content()).isEqualTo("Hello");
        assertThat(result.finalResult().join().ok()).isTrue();
    }

    @Test
    @DisplayName("Stream failure reports seen usage, then error and done")
    void streamFailure() {
        streamReturns(Flux.concat(Flux.just(chunk("Hel", 10, 2)), Flux.error(new IllegalStateException("reset"))));
        when(modelCatalogService.estimateCostUsd("gpt-4o-mini", 10, 2)).thenReturn(Optional.empty());

        GraphRunResult result = provider.runGraph(request(new AbortSignal()));
        List<AiEvent> events = result.stream().toList();

        assertThat(events).extracting(AiEvent::type).containsExactly("text_delta", "usage_report", "error", "done");
        assertThat(events.get(2)).isEqualTo(new ErrorEvent("reset"));
        assertThat(((UsageReportEvent) events.get(1)).fact().costUsd()).isNull();
        assertThat(result.finalResult().join().error()).isEqualTo(GraphErrorCode.PROVIDER_ERROR);
    }

    @Test
    @DisplayName("Abort before start still reports usage and ends with aborted")
    void abortedRun() {
        AbortSignal abortSignal = new AbortSignal();
        abortSignal.abort();
        // upstream may or may not be subscribed before the abort completes the run
        lenient().when(chatClient.prompt().messages(anyList()).options(any()).stream().chatResponse())
                .thenReturn(Flux.just(chunk("never", 10, 2)));
        when(modelCatalogService.estimateCostUsd("gpt-4o-mini", null, null)).thenReturn(Optional.empty());

        GraphRunResult result = provider.runGraph(request(abortSignal));
        List<AiEvent> events = result.stream().toList();

        assertThat(events).extracting(AiEvent::type).containsExactly("usage_report", "error", "done");
        assertThat(events.get(1)).isEqualTo(ErrorEvent.aborted());
        assertThat(result.finalResult().join().error()).isEqualTo(GraphErrorCode.ABORTED);
    }
}
