package dev.receiptly.processor.validation;

/**
 * The OCR service decided the image does not show a receipt.
 */
public class InvalidReceiptException extends RuntimeException {

    private final double confidence;

    public InvalidReceiptException(String message, double confidence) {
        super(message);
        this.confidence = confidence;
    }

    public double getConfidence() {
        return confidence;
    }
}
