package uk.gegc.aimeter.features.ai.domain.event;

public record ToolCallResultEvent(String toolCallId, String toolName, Object result, boolean isError) implements AiEvent {

    @Override
    public String type() {
        return "tool_call_result";
    }
}
