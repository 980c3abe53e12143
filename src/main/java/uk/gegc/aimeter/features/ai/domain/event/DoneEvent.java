package uk.gegc.aimeter.features.ai.domain.event;

public record DoneEvent() implements AiEvent {

    @Override
    public String type() {
        return "done";
    }
}
