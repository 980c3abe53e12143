package uk.gegc.aimeter.features.ai.domain.model;

public record ChatCompletion(
        String requestId,
        String content,
        String model,
        String finishReason,
        TokenUsage usage
) {
}
