package dev.receiptly.storage;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Audit document written next to a quarantined receipt.
 *
 * @param reason human readable failure reason, prefixed with the failure category
 * @param originalKey key the image was uploaded to, {@code null} if the upload never completed
 * @param quarantineKey key the image was moved to, {@code null} when nothing was quarantined
 * @param ocrResponse raw OCR response body when one was received
 * @param exception summary of the exception that ended the ingestion
 */
public record FailureRecord(
    UUID receiptId,
    String userId,
    String reason,
    Instant failedAt,
    String originalKey,
    String quarantineKey,
    String ocrResponse,
    ExceptionSummary exception
) {

    public FailureRecord {
        Objects.requireNonNull(receiptId, "receiptId");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(failedAt, "failedAt");
    }

    public record ExceptionSummary(String type, String message, String causeMessage) {

        public static ExceptionSummary of(Throwable throwable) {
            if (throwable == null) {
                return null;
            }
            Throwable cause = throwable.getCause();
            return new ExceptionSummary(throwable.getClass().getName(), throwable.getMessage(),
                cause != null ? cause.getMessage() : null);
        }
    }
}
