package uk.gegc.aimeter.features.ai.domain.model;

import uk.gegc.aimeter.features.ai.domain.event.AiEvent;
import uk.gegc.aimeter.features.ai.domain.event.DoneEvent;
import uk.gegc.aimeter.features.ai.domain.event.ErrorEvent;

import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Pair returned by every graph execution: a lazily evaluated event stream plus the final result.
 */
public record GraphRunResult(Stream<AiEvent> stream, CompletableFuture<GraphFinal> finalResult) {

    /**
     * Synthetic failed run: an {@code error} then {@code done}, with an already completed failed final.
     */
    public static GraphRunResult failed(String runId, String requestId, String message, GraphErrorCode code) {
        return new GraphRunResult(
                Stream.of(new ErrorEvent(message), new DoneEvent()),
                CompletableFuture.completedFuture(GraphFinal.failure(runId, requestId, code)));
    }
}
