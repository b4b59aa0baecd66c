package dev.receiptly.processor.ocr;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff for OCR calls. {@code maxRetries} counts retries after the first attempt, so
 * three retries with a two second initial backoff wait 2s, 4s and 8s.
 */
public record OcrRetryPolicy(int maxRetries, Duration initialBackoff, double multiplier, boolean retryOnNotFound) {

    public static final OcrRetryPolicy DEFAULT = new OcrRetryPolicy(3, Duration.ofSeconds(2), 2.0, true);

    public OcrRetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        if (initialBackoff.isNegative() || initialBackoff.isZero()) {
            throw new IllegalArgumentException("initialBackoff must be positive");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0");
        }
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }
}
