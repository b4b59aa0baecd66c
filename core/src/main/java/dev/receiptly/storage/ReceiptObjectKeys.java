package dev.receiptly.storage;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriUtils;

/**
 * Object store layout for a single ingestion. Every key is derived from the owner, the ingestion
 * date and the receipt id, so the same inputs always address the same objects.
 *
 * <pre>
 * users/{userId}/receipts/{yyyy}/{MM}/{dd}/{receiptId}/{file}
 * users/{userId}/failed-receipts/{yyyy}/{MM}/{dd}/{receiptId}/{file}
 * </pre>
 */
public record ReceiptObjectKeys(String userId, LocalDate ingestionDate, UUID receiptId) {

    static final String FAILURE_RECORD_FILE_NAME = "failure_details.json";
    static final String DEFAULT_FILE_NAME = "receipt";
    static final int MAX_OBJECT_FILENAME_LENGTH = 60;

    private static final DateTimeFormatter DATE_PATH =
        DateTimeFormatter.ofPattern("yyyy/MM/dd", Locale.ROOT);

    public ReceiptObjectKeys {
        if (!StringUtils.hasText(userId)) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        Objects.requireNonNull(ingestionDate, "ingestionDate");
        Objects.requireNonNull(receiptId, "receiptId");
    }

    public String receiptPrefix() {
        return prefix("receipts");
    }

    public String quarantinePrefix() {
        return prefix("failed-receipts");
    }

    public String original(String filename) {
        return receiptPrefix() + sanitizeFilename(filename);
    }

    public String snapshot(SnapshotKind kind) {
        Objects.requireNonNull(kind, "kind");
        return receiptPrefix() + kind.fileName();
    }

    /**
     * Quarantine key for an object previously stored under {@link #receiptPrefix()}.
     */
    public String quarantine(String originalKey) {
        if (!StringUtils.hasText(originalKey)) {
            throw new IllegalArgumentException("originalKey must not be blank");
        }
        int separatorIndex = originalKey.lastIndexOf('/');
        String fileName = separatorIndex >= 0 ? originalKey.substring(separatorIndex + 1) : originalKey;
        return quarantinePrefix() + (StringUtils.hasText(fileName) ? fileName : DEFAULT_FILE_NAME);
    }

    public String failureRecord() {
        return quarantinePrefix() + FAILURE_RECORD_FILE_NAME;
    }

    private String prefix(String area) {
        return "users/" + UriUtils.encodePathSegment(userId, StandardCharsets.UTF_8) + "/" + area + "/"
            + DATE_PATH.format(ingestionDate) + "/" + receiptId + "/";
    }

    static String sanitizeFilename(String originalFilename) {
        String filename = StringUtils.hasText(originalFilename) ? originalFilename : DEFAULT_FILE_NAME;
        filename = extractFilename(filename);
        if (".".equals(filename) || "..".equals(filename)) {
            filename = DEFAULT_FILE_NAME;
        }
        filename = shortenFilename(filename, MAX_OBJECT_FILENAME_LENGTH);
        filename = encodeFilename(filename);
        return StringUtils.hasText(filename) ? filename : DEFAULT_FILE_NAME;
    }

    private static String extractFilename(String filename) {
        int separatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        if (separatorIndex >= 0) {
            return filename.substring(separatorIndex + 1);
        }
        return filename;
    }

    private static String encodeFilename(String filename) {
        if (!StringUtils.hasText(filename)) {
            return filename;
        }
        return UriUtils.encodePathSegment(filename, StandardCharsets.UTF_8);
    }

    private static String shortenFilename(String filename, int maxLength) {
        if (!StringUtils.hasText(filename) || filename.length() <= maxLength) {
            return filename;
        }

        int extensionIndex = filename.lastIndexOf('.');
        if (extensionIndex > 0 && extensionIndex < filename.length() - 1) {
            String baseName = filename.substring(0, extensionIndex);
            String extension = filename.substring(extensionIndex);
            int allowedBaseLength = Math.max(1, maxLength - extension.length() - 1);
            if (baseName.length() > allowedBaseLength) {
                baseName = baseName.substring(0, allowedBaseLength);
            }
            return baseName + "…" + extension;
        }

        int safeLength = Math.max(1, maxLength - 1);
        return filename.substring(0, safeLength) + "…";
    }
}
