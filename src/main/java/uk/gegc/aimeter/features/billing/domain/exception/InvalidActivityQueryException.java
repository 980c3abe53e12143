package uk.gegc.aimeter.features.billing.domain.exception;

public class InvalidActivityQueryException extends RuntimeException {

    public InvalidActivityQueryException(String message) {
        super(message);
    }
}
