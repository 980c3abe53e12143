package uk.gegc.aimeter.features.ai.domain.model;

import java.util.List;

/**
 * @param graphName   namespaced graph id, {@code <providerId>:<graphName>}
 * @param abortSignal fired when the caller goes away; never {@code null}
 */
public record GraphRunRequest(
        String runId,
        String ingressRequestId,
        String graphName,
        List<ChatMessage> messages,
        String model,
        CallerIdentity caller,
        AbortSignal abortSignal
) {

    public RunContext runContext() {
        return RunContext.firstAttempt(runId, ingressRequestId);
    }
}
