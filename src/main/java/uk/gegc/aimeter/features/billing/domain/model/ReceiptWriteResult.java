package uk.gegc.aimeter.features.billing.domain.model;

/**
 * Outcome of a receipt write. {@code DUPLICATE} means the idempotency key was already recorded
 * and counts as success.
 */
public enum ReceiptWriteResult {
    RECORDED,
    DUPLICATE
}
