package uk.gegc.aimeter.features.ai.domain.event;

public record ErrorEvent(String error) implements AiEvent {

    public static final String ABORTED = "aborted";

    public static ErrorEvent aborted() {
        return new ErrorEvent(ABORTED);
    }

    @Override
    public String type() {
        return "error";
    }
}
