package uk.gegc.aimeter.features.ai.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.aimeter.features.ai.domain.model.ChatCompletion;

@Schema(name = "ChatCompletionResponse", description = "Single-shot completion result")
public record ChatCompletionResponse(
        String requestId,
        String content,
        String model,
        String finishReason,
        Integer promptTokens,
        Integer completionTokens
) {
    public static ChatCompletionResponse from(ChatCompletion completion) {
        return new ChatCompletionResponse(
                completion.requestId(),
                completion.content(),
                completion.model(),
                completion.finishReason(),
                completion.usage() != null ? completion.usage().promptTokens() : null,
                completion.usage() != null ? completion.usage().completionTokens() : null);
    }
}
