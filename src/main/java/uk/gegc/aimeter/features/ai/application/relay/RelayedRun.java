package uk.gegc.aimeter.features.ai.application.relay;

import uk.gegc.aimeter.features.ai.domain.model.GraphFinal;

import java.util.concurrent.CompletableFuture;

/**
 * @param uiStream       caller-facing events, never containing {@code usage_report}
 * @param finalResult    provider final result, passed through
 * @param pumpCompletion completes once the provider stream is drained and all usage committed;
 *                       completes exceptionally when a ledger failure surfaced (test mode)
 */
public record RelayedRun(
        UiEventStream uiStream,
        CompletableFuture<GraphFinal> finalResult,
        CompletableFuture<Void> pumpCompletion
) {
}
