package uk.gegc.aimeter.features.ai.domain.model;

public enum GraphErrorCode {
    INTERNAL("internal"),
    ABORTED("aborted"),
    TIMEOUT("timeout"),
    PROVIDER_ERROR("provider_error");

    private final String wireName;

    GraphErrorCode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
