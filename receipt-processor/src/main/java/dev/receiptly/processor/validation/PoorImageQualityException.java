package dev.receiptly.processor.validation;

import java.util.Locale;

/**
 * The image was recognised as a receipt but too unclear to read reliably.
 */
public class PoorImageQualityException extends RuntimeException {

    private final double confidence;
    private final double threshold;

    public PoorImageQualityException(double confidence, double threshold) {
        super(String.format(Locale.ROOT, "Image confidence %.2f is below the required %.2f", confidence, threshold));
        this.confidence = confidence;
        this.threshold = threshold;
    }

    public double getConfidence() {
        return confidence;
    }

    public double getThreshold() {
        return threshold;
    }
}
