package dev.receiptly.processor.validation;

public enum ValidationOutcome {
    ACCEPTED,
    NOT_A_RECEIPT,
    POOR_IMAGE_QUALITY
}
