package uk.gegc.aimeter.features.ai.application;

import uk.gegc.aimeter.features.ai.application.relay.UiEventStream;
import uk.gegc.aimeter.features.ai.domain.model.AbortSignal;
import uk.gegc.aimeter.features.ai.domain.model.GraphFinal;

import java.util.concurrent.CompletableFuture;

/**
 * A started streaming run.
 *
 * @param abortSignal    fire to stop generation; billing of reported usage still completes
 * @param billingSettled completes once every usage report of the run has been committed
 */
public record ChatRunHandle(
        String runId,
        String requestId,
        String graphName,
        UiEventStream events,
        AbortSignal abortSignal,
        CompletableFuture<GraphFinal> finalResult,
        CompletableFuture<Void> billingSettled
) {
}
