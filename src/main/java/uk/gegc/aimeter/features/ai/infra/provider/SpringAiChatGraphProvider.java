package uk.gegc.aimeter.features.ai.infra.provider;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import uk.gegc.aimeter.features.ai.application.GraphProvider;
import uk.gegc.aimeter.features.ai.domain.event.AiEvent;
import uk.gegc.aimeter.features.ai.domain.event.AssistantFinalEvent;
import uk.gegc.aimeter.features.ai.domain.event.DoneEvent;
import uk.gegc.aimeter.features.ai.domain.event.ErrorEvent;
import uk.gegc.aimeter.features.ai.domain.event.TextDeltaEvent;
import uk.gegc.aimeter.features.ai.domain.event.UsageReportEvent;
import uk.gegc.aimeter.features.ai.domain.model.ChatMessage;
import uk.gegc.aimeter.features.ai.domain.model.GraphDescriptor;
import uk.gegc.aimeter.features.ai.domain.model.GraphErrorCode;
import uk.gegc.aimeter.features.ai.domain.model.GraphFinal;
import uk.gegc.aimeter.features.ai.domain.model.GraphId;
import uk.gegc.aimeter.features.ai.domain.model.GraphRunRequest;
import uk.gegc.aimeter.features.ai.domain.model.GraphRunResult;
import uk.gegc.aimeter.features.ai.domain.model.TokenUsage;
import uk.gegc.aimeter.features.ai.domain.model.UsageFact;
import uk.gegc.aimeter.features.billing.application.ModelCatalogService;
import uk.gegc.aimeter.features.billing.domain.model.SourceSystem;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Streaming chat graph backed by a Spring AI {@link ChatClient}.
 * <p>
 * Spring AI does not report cost, so {@code costUsd} comes from the model catalog price table
 * and stays absent for unpriced models (degraded billing). Abort cancels the upstream flux; usage
 * seen up to that point is still reported.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpringAiChatGraphProvider implements GraphProvider {

    public static final String PROVIDER_ID = "springai";
    static final String CHAT_GRAPH = "chat";

    private final ChatClient chatClient;
    private final ModelCatalogService modelCatalogService;

    @Override
    public String providerId() {
        return PROVIDER_ID;
    }

    @Override
    public List<GraphDescriptor> listGraphs() {
        return List.of(new GraphDescriptor(
                new GraphId(PROVIDER_ID, CHAT_GRAPH).toString(),
                "Streaming chat",
                "Token-streamed chat through Spring AI"));
    }

    @Override
    public GraphRunResult runGraph(GraphRunRequest request) {
        boolean known = GraphId.parse(request.graphName())
                .map(id -> CHAT_GRAPH.equals(id.graphName()))
                .orElse(false);
        if (!known) {
            return GraphRunResult.failed(request.runId(), request.ingressRequestId(),
                    "Unknown graph: " + request.graphName(), GraphErrorCode.INTERNAL);
        }

        String model = modelCatalogService.resolveModel(request.model());
        CompletableFuture<GraphFinal> finalResult = new CompletableFuture<>();
        StringBuilder content = new StringBuilder();
        AtomicReference<String> responseId = new AtomicReference<>();
        AtomicReference<Integer> promptTokens = new AtomicReference<>();
        AtomicReference<Integer> completionTokens = new AtomicReference<>();

        Mono<Void> aborted = Mono.create(sink -> request.abortSignal().onAbort(sink::success));

        Flux<AiEvent> deltas = Flux.defer(() -> chatClient.prompt()
                        .messages(toSpringMessages(request.messages()))
                        .options(OpenAiChatOptions.builder().model(model).streamUsage(true).build())
                        .stream()
                        .chatResponse())
                .takeUntilOther(aborted)
                .doOnNext(response -> captureMetadata(response, responseId, promptTokens, completionTokens))
                .map(SpringAiChatGraphProvider::extractDeltaText)
                .filter(text -> !text.isEmpty())
                .doOnNext(content::append)
                .<AiEvent>map(TextDeltaEvent::new);

        Flux<AiEvent> events = deltas
                .concatWith(Flux.defer(() -> {
                    List<AiEvent> tail = new ArrayList<>();
                    tail.add(usageReport(request, model, responseId.get(), promptTokens.get(), completionTokens.get()));
                    TokenUsage usage = new TokenUsage(promptTokens.get(), completionTokens.get());
                    if (request.abortSignal().isAborted()) {
                        finalResult.complete(GraphFinal.failure(request.runId(), request.ingressRequestId(), GraphErrorCode.ABORTED));
                        tail.add(ErrorEvent.aborted());
                    } else {
                        finalResult.complete(GraphFinal.success(request.runId(), request.ingressRequestId(), usage, "stop"));
                        tail.add(new AssistantFinalEvent(content.toString()));
                    }
                    tail.add(new DoneEvent());
                    return Flux.fromIterable(tail);
                }))
                .onErrorResume(e -> Flux.defer(() -> {
                    log.warn("Spring AI stream failed runId={} model={}: {}", request.runId(), model, e.getMessage());
                    finalResult.complete(GraphFinal.failure(request.runId(), request.ingressRequestId(), GraphErrorCode.PROVIDER_ERROR));
                    List<AiEvent> tail = new ArrayList<>();
                    if (promptTokens.get() != null || completionTokens.get() != null) {
                        tail.add(usageReport(request, model, responseId.get(), promptTokens.get(), completionTokens.get()));
                    }
                    tail.add(new ErrorEvent(e.getMessage() != null ? e.getMessage() : "LLM stream failed"));
                    tail.add(new DoneEvent());
                    return Flux.fromIterable(tail);
                }));

        Stream<AiEvent> stream = events.toStream()
                .onClose(() -> finalResult.complete(
                        GraphFinal.failure(request.runId(), request.ingressRequestId(), GraphErrorCode.INTERNAL)));
        return new GraphRunResult(stream, finalResult);
    }

    private UsageReportEvent usageReport(GraphRunRequest request, String model, String responseId,
                                         Integer promptTokens, Integer completionTokens) {
        BigDecimal costUsd = modelCatalogService.estimateCostUsd(model, promptTokens, completionTokens).orElse(null);
        return new UsageReportEvent(new UsageFact(
                request.runId(),
                request.runContext().attempt(),
                request.caller().billingAccountId(),
                request.caller().virtualKeyId(),
                request.ingressRequestId(),
                SourceSystem.SPRING_AI,
                model,
                costUsd,
                responseId,
                promptTokens,
                completionTokens));
    }

    private static void captureMetadata(ChatResponse response, AtomicReference<String> responseId,
                                        AtomicReference<Integer> promptTokens,
                                        AtomicReference<Integer> completionTokens) {
        if (response == null || response.getMetadata() == null) {
            return;
        }
        String id = response.getMetadata().getId();
        if (id != null && !id.isBlank()) {
            responseId.set(id);
        }
        Usage usage = response.getMetadata().getUsage();
        if (usage == null) {
            return;
        }
        if (usage.getPromptTokens() != null && usage.getPromptTokens() > 0) {
            promptTokens.set(usage.getPromptTokens());
        }
        if (usage.getCompletionTokens() != null && usage.getCompletionTokens() > 0) {
            completionTokens.set(usage.getCompletionTokens());
        }
    }

    private static String extractDeltaText(ChatResponse response) {
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            return "";
        }
        String text = response.getResult().getOutput().getText();
        return text != null ? text : "";
    }

    private static List<Message> toSpringMessages(List<ChatMessage> messages) {
        List<Message> result = new ArrayList<>(messages.size());
        for (ChatMessage message : messages) {
            switch (message.role()) {
                case SYSTEM -> result.add(new SystemMessage(message.content()));
                case ASSISTANT -> result.add(new AssistantMessage(message.content()));
                default -> result.add(new UserMessage(message.content()));
            }
        }
        return result;
    }
}
