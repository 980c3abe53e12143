package uk.gegc.aimeter.features.ai.domain.model;

import java.util.List;

public record LlmCompletionRequest(
        String model,
        List<ChatMessage> messages,
        CallerIdentity caller
) {
}
