package uk.gegc.aimeter.features.ai.domain.model;

/**
 * Authenticated principal and correlation ids of one inbound request.
 * Built once at the HTTP boundary and passed by value afterwards.
 */
public record CallerIdentity(
        String billingAccountId,
        String virtualKeyId,
        String requestId,
        String traceId
) {
}
