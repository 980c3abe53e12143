package uk.gegc.aimeter.features.billing.domain.exception;

public class AccountNotFoundException extends RuntimeException {

    private final String billingAccountId;

    public AccountNotFoundException(String billingAccountId) {
        super("Billing account not found: " + billingAccountId);
        this.billingAccountId = billingAccountId;
    }

    public String getBillingAccountId() {
        return billingAccountId;
    }
}
