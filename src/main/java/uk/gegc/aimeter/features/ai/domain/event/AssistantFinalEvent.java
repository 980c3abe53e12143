package uk.gegc.aimeter.features.ai.domain.event;

public record AssistantFinalEvent(String content) implements AiEvent {

    @Override
    public String type() {
        return "assistant_final";
    }
}
