package uk.gegc.aimeter.features.ai.domain.model;

public record TokenUsage(Integer promptTokens, Integer completionTokens) {
}
