package uk.gegc.aimeter.features.ai.domain.model;

/**
 * Final outcome of a graph run, resolved independently of the event stream.
 */
public record GraphFinal(
        boolean ok,
        String runId,
        String requestId,
        TokenUsage usage,
        String finishReason,
        GraphErrorCode error
) {

    public static GraphFinal success(String runId, String requestId, TokenUsage usage, String finishReason) {
        return new GraphFinal(true, runId, requestId, usage, finishReason, null);
    }

    public static GraphFinal failure(String runId, String requestId, GraphErrorCode error) {
        return new GraphFinal(false, runId, requestId, null, null, error);
    }
}
