package uk.gegc.aimeter.features.ai.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import uk.gegc.aimeter.features.ai.domain.model.ChatMessage;
import uk.gegc.aimeter.features.ai.domain.model.ChatRole;

@Schema(name = "ChatMessageDto", description = "One message of the conversation")
public record ChatMessageDto(
        @Schema(description = "Message author", example = "USER")
        @NotNull(message = "Role must not be null")
        ChatRole role,

        @Schema(description = "Message text", example = "Hello!")
        @NotNull(message = "Content must not be null")
        String content
) {
    public ChatMessage toDomain() {
        return new ChatMessage(role, content);
    }
}
