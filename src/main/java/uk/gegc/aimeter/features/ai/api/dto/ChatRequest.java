package uk.gegc.aimeter.features.ai.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import uk.gegc.aimeter.features.ai.domain.model.ChatRunRequest;

import java.util.List;

@Schema(name = "ChatRequest", description = "Chat run request")
public record ChatRequest(
        @Schema(description = "Conversation so far, oldest first")
        @NotEmpty(message = "Messages must not be empty")
        List<@Valid ChatMessageDto> messages,

        @Schema(description = "Model id; the catalog default is used when omitted", example = "gpt-4o-mini")
        @Size(max = 128, message = "Model must not exceed 128 characters")
        String model,

        @Schema(description = "Namespaced graph id for streamed runs", example = "inproc:chat")
        @Size(max = 128, message = "Graph name must not exceed 128 characters")
        String graphName
) {
    public ChatRunRequest toRunRequest() {
        return new ChatRunRequest(graphName, model, messages.stream().map(ChatMessageDto::toDomain).toList());
    }
}
