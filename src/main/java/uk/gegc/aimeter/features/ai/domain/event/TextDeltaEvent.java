package uk.gegc.aimeter.features.ai.domain.event;

public record TextDeltaEvent(String delta) implements AiEvent {

    @Override
    public String type() {
        return "text_delta";
    }
}
