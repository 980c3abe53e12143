package uk.gegc.aimeter.features.billing.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether a charge came from a streamed run or a single-shot completion.
 */
public enum ChargeProvenance {
    RESPONSE("response"),
    STREAM("stream");

    private final String wireName;

    ChargeProvenance(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
