package uk.gegc.aimeter.features.ai.infra.provider;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.aimeter.features.ai.application.GraphProvider;
import uk.gegc.aimeter.features.ai.application.LlmCompletionPort;
import uk.gegc.aimeter.features.ai.domain.event.AiEvent;
import uk.gegc.aimeter.features.ai.domain.event.AssistantFinalEvent;
import uk.gegc.aimeter.features.ai.domain.event.DoneEvent;
import uk.gegc.aimeter.features.ai.domain.event.ErrorEvent;
import uk.gegc.aimeter.features.ai.domain.event.TextDeltaEvent;
import uk.gegc.aimeter.features.ai.domain.event.UsageReportEvent;
import uk.gegc.aimeter.features.ai.domain.model.CallerIdentity;
import uk.gegc.aimeter.features.ai.domain.model.GraphDescriptor;
import uk.gegc.aimeter.features.ai.domain.model.GraphErrorCode;
import uk.gegc.aimeter.features.ai.domain.model.GraphFinal;
import uk.gegc.aimeter.features.ai.domain.model.GraphId;
import uk.gegc.aimeter.features.ai.domain.model.GraphRunRequest;
import uk.gegc.aimeter.features.ai.domain.model.GraphRunResult;
import uk.gegc.aimeter.features.ai.domain.model.LlmCompletionRequest;
import uk.gegc.aimeter.features.ai.domain.model.LlmCompletionResult;
import uk.gegc.aimeter.features.ai.domain.model.UsageFact;
import uk.gegc.aimeter.features.billing.application.ModelCatalogService;
import uk.gegc.aimeter.features.billing.domain.model.SourceSystem;
import uk.gegc.aimeter.shared.exception.AiServiceException;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * In-process single-node chat graph: one completion through the LiteLLM proxy per run.
 * The usage report follows the final message, as proxies report cost after the response.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InProcChatGraphProvider implements GraphProvider {

    public static final String PROVIDER_ID = "inproc";
    static final String CHAT_GRAPH = "chat";

    private final LlmCompletionPort completionPort;
    private final ModelCatalogService modelCatalogService;

    @Override
    public String providerId() {
        return PROVIDER_ID;
    }

    @Override
    public List<GraphDescriptor> listGraphs() {
        return List.of(new GraphDescriptor(
                new GraphId(PROVIDER_ID, CHAT_GRAPH).toString(),
                "Chat",
                "Single LLM completion through the LiteLLM proxy"));
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

        CompletableFuture<GraphFinal> finalResult = new CompletableFuture<>();
        Stream<AiEvent> stream = Stream.of(request)
                .flatMap(r -> execute(r, finalResult))
                .onClose(() -> finalResult.complete(
                        GraphFinal.failure(request.runId(), request.ingressRequestId(), GraphErrorCode.INTERNAL)));
        return new GraphRunResult(stream, finalResult);
    }

    private Stream<AiEvent> execute(GraphRunRequest request, CompletableFuture<GraphFinal> finalResult) {
        if (request.abortSignal().isAborted()) {
            finalResult.complete(GraphFinal.failure(request.runId(), request.ingressRequestId(), GraphErrorCode.ABORTED));
            return Stream.of(ErrorEvent.aborted(), new DoneEvent());
        }

        CallerIdentity caller = request.caller();
        String model = modelCatalogService.resolveModel(request.model());
        LlmCompletionResult result;
        try {
            result = completionPort.completion(new LlmCompletionRequest(model, request.messages(), caller));
        } catch (AiServiceException e) {
            log.warn("Completion failed runId={} model={}: {}", request.runId(), model, e.getMessage());
            finalResult.complete(GraphFinal.failure(request.runId(), request.ingressRequestId(), GraphErrorCode.PROVIDER_ERROR));
            return Stream.of(new ErrorEvent(e.getMessage()), new DoneEvent());
        }

        UsageFact fact = new UsageFact(
                request.runId(),
                request.runContext().attempt(),
                caller.billingAccountId(),
                caller.virtualKeyId(),
                request.ingressRequestId(),
                SourceSystem.LITELLM,
                result.model(),
                result.providerCostUsd(),
                result.litellmCallId(),
                result.usage() != null ? result.usage().promptTokens() : null,
                result.usage() != null ? result.usage().completionTokens() : null);

        finalResult.complete(GraphFinal.success(request.runId(), request.ingressRequestId(),
                result.usage(), result.finishReason()));

        return Stream.of(
                new TextDeltaEvent(result.content()),
                new AssistantFinalEvent(result.content()),
                new UsageReportEvent(fact),
                new DoneEvent());
    }
}
