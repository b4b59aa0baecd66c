package dev.receiptly.processor.validation;

import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * Pure accept/reject decision over an OCR verdict. Not-a-receipt wins over image quality.
 */
public class ValidationGate {

    public static final double DEFAULT_POOR_QUALITY_THRESHOLD = 0.5;
    static final String DEFAULT_INVALID_MESSAGE = "Receipt validation failed";

    private final double poorQualityThreshold;

    public ValidationGate() {
        this(DEFAULT_POOR_QUALITY_THRESHOLD);
    }

    public ValidationGate(double poorQualityThreshold) {
        if (poorQualityThreshold < 0.0 || poorQualityThreshold > 1.0) {
            throw new IllegalArgumentException("poorQualityThreshold must be between 0 and 1");
        }
        this.poorQualityThreshold = poorQualityThreshold;
    }

    public double getPoorQualityThreshold() {
        return poorQualityThreshold;
    }

    public ValidationOutcome evaluate(ValidationVerdict verdict) {
        Objects.requireNonNull(verdict, "verdict");
        if (!verdict.validReceipt()) {
            return ValidationOutcome.NOT_A_RECEIPT;
        }
        if (verdict.confidence() < poorQualityThreshold) {
            return ValidationOutcome.POOR_IMAGE_QUALITY;
        }
        return ValidationOutcome.ACCEPTED;
    }

    /**
     * @throws InvalidReceiptException when the image is not a receipt
     * @throws PoorImageQualityException when the confidence is below the threshold
     */
    public void enforce(ValidationVerdict verdict) {
        switch (evaluate(verdict)) {
            case NOT_A_RECEIPT -> throw new InvalidReceiptException(
                StringUtils.hasText(verdict.message()) ? verdict.message() : DEFAULT_INVALID_MESSAGE,
                verdict.confidence());
            case POOR_IMAGE_QUALITY -> throw new PoorImageQualityException(verdict.confidence(), poorQualityThreshold);
            case ACCEPTED -> {
            }
            default -> throw new IllegalStateException("Unhandled validation outcome");
        }
    }
}
