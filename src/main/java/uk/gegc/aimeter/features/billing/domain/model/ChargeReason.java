package uk.gegc.aimeter.features.billing.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ChargeReason {
    LLM_USAGE("llm_usage");

    private final String wireName;

    ChargeReason(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
