package uk.gegc.aimeter.features.ai.domain.exception;

public class MessageTooLongException extends RuntimeException {

    private final int length;
    private final int maxLength;

    public MessageTooLongException(int length, int maxLength) {
        super("Message exceeds maximum length of " + maxLength + " characters (got " + length + ")");
        this.length = length;
        this.maxLength = maxLength;
    }

    public int getLength() {
        return length;
    }

    public int getMaxLength() {
        return maxLength;
    }
}
