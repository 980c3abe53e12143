package uk.gegc.aimeter.shared.exception;

public class MissingCallerIdentityException extends RuntimeException {

    public MissingCallerIdentityException(String message) {
        super(message);
    }
}
