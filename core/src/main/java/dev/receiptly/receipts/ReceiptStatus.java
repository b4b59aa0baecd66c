package dev.receiptly.receipts;

/**
 * Lifecycle of a receipt. Transitions only move forward out of {@link #PENDING_VALIDATION}.
 */
public enum ReceiptStatus {

    PENDING_VALIDATION,
    VALIDATED,
    VALIDATION_FAILED;

    public boolean canTransitionTo(ReceiptStatus target) {
        return this == PENDING_VALIDATION && (target == VALIDATED || target == VALIDATION_FAILED);
    }
}
