package uk.gegc.aimeter.features.billing.domain.exception;

/**
 * Admission rejected the request before any provider call.
 */
public class InsufficientCreditsException extends RuntimeException {

    private final String billingAccountId;
    private final long requiredCredits;
    private final long availableCredits;

    public InsufficientCreditsException(String billingAccountId, long requiredCredits, long availableCredits) {
        super("Insufficient credits: required " + requiredCredits + ", available " + availableCredits);
        this.billingAccountId = billingAccountId;
        this.requiredCredits = requiredCredits;
        this.availableCredits = availableCredits;
    }

    public String getBillingAccountId() {
        return billingAccountId;
    }

    public long getRequiredCredits() {
        return requiredCredits;
    }

    public long getAvailableCredits() {
        return availableCredits;
    }
}
