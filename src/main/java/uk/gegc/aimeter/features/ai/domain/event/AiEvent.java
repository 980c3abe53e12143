package uk.gegc.aimeter.features.ai.domain.event;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One event of a graph run as produced by a provider.
 * <p>
 * Every run visible to a caller ends with exactly one {@link AssistantFinalEvent} or
 * {@link ErrorEvent} followed by a single {@link DoneEvent}. {@link UsageReportEvent}s carry
 * billing data only and never reach the caller.
 */
public sealed interface AiEvent permits TextDeltaEvent, ToolCallStartEvent, ToolCallResultEvent,
        UsageReportEvent, AssistantFinalEvent, ErrorEvent, DoneEvent {

    /**
     * Wire discriminator, also used as the SSE event name.
     */
    @JsonProperty("type")
    String type();
}
