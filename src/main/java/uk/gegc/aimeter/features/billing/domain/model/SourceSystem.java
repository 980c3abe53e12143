package uk.gegc.aimeter.features.billing.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * System that reported a unit of usage. Part of the receipt idempotency key.
 */
public enum SourceSystem {
    LITELLM("litellm"),
    SPRING_AI("spring_ai");

    private final String wireName;

    SourceSystem(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
