package uk.gegc.aimeter.features.ai.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.aimeter.features.ai.application.AiRuntimeProperties;
import uk.gegc.aimeter.features.ai.application.AiRuntimeService;
import uk.gegc.aimeter.features.ai.application.ChatRunHandle;
import uk.gegc.aimeter.features.ai.application.ConversationPolicy;
import uk.gegc.aimeter.features.ai.application.GraphExecutor;
import uk.gegc.aimeter.features.ai.application.relay.RelayedRun;
import uk.gegc.aimeter.features.ai.application.relay.RunEventRelay;
import uk.gegc.aimeter.features.ai.domain.model.AbortSignal;
import uk.gegc.aimeter.features.ai.domain.model.CallerIdentity;
import uk.gegc.aimeter.features.ai.domain.model.ChatMessage;
import uk.gegc.aimeter.features.ai.domain.model.ChatRunRequest;
import uk.gegc.aimeter.features.ai.domain.model.GraphDescriptor;
import uk.gegc.aimeter.features.ai.domain.model.GraphRunRequest;
import uk.gegc.aimeter.features.ai.domain.model.GraphRunResult;
import uk.gegc.aimeter.features.billing.application.AdmissionService;

import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class AiRuntimeServiceImpl implements AiRuntimeService {

    private final ConversationPolicy conversationPolicy;
    private final AdmissionService admissionService;
    private final GraphExecutor graphExecutor;
    private final RunEventRelay runEventRelay;
    private final AiRuntimeProperties runtimeProperties;

    @Override
    public ChatRunHandle runChatStream(ChatRunRequest request, CallerIdentity caller) {
        List<ChatMessage> messages = conversationPolicy.prepare(request.messages());
        admissionService.admit(messages, caller);

        String runId = "run_" + UUID.randomUUID();
        String graphName = request.graphName() == null || request.graphName().isBlank()
                ? runtimeProperties.getDefaultGraph()
                : request.graphName();
        AbortSignal abortSignal = new AbortSignal();

        GraphRunRequest graphRequest = new GraphRunRequest(runId, caller.requestId(), graphName,
                messages, request.model(), caller, abortSignal);
        GraphRunResult result = graphExecutor.runGraph(graphRequest);
        RelayedRun relayed = runEventRelay.relay(result, graphRequest.runContext(), abortSignal);

        log.info("Run started runId={} graph={} accountId={} messages={}",
                runId, graphName, caller.billingAccountId(), messages.size());
        return new ChatRunHandle(runId, caller.requestId(), graphName, relayed.uiStream(), abortSignal,
                relayed.finalResult(), relayed.pumpCompletion());
    }

    @Override
    public List<GraphDescriptor> listGraphs() {
        return graphExecutor.listGraphs();
    }
}
