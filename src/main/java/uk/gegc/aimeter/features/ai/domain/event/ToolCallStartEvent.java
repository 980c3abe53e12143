package uk.gegc.aimeter.features.ai.domain.event;

import java.util.Map;

public record ToolCallStartEvent(String toolCallId, String toolName, Map<String, Object> args) implements AiEvent {

    @Override
    public String type() {
        return "tool_call_start";
    }
}
