package uk.gegc.aimeter.features.ai.domain.model;

public enum ChatRole {
    SYSTEM,
    USER,
    ASSISTANT
}
