package uk.gegc.aimeter.features.ai.domain.exception;

public class InvalidConversationException extends RuntimeException {

    public InvalidConversationException(String message) {
        super(message);
    }
}
