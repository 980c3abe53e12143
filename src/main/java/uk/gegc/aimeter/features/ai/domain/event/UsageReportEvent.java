package uk.gegc.aimeter.features.ai.domain.event;

import uk.gegc.aimeter.features.ai.domain.model.UsageFact;

/**
 * Billing-only event. Consumed by the relay pump and never forwarded to the caller.
 */
public record UsageReportEvent(UsageFact fact) implements AiEvent {

    @Override
    public String type() {
        return "usage_report";
    }
}
