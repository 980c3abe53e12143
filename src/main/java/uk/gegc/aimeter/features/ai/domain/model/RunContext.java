package uk.gegc.aimeter.features.ai.domain.model;

/**
 * Identifies one execution of a graph.
 *
 * @param attempt          retry ordinal, currently always {@code 0}
 * @param ingressRequestId request that delivered this run; differs from {@code runId} on reconnect
 */
public record RunContext(String runId, int attempt, String ingressRequestId) {

    public static RunContext firstAttempt(String runId, String ingressRequestId) {
        return new RunContext(runId, 0, ingressRequestId);
    }
}
