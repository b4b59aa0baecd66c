package dev.receiptly.receipts;

import java.util.UUID;

/**
 * Thrown when storing a receipt whose content hash is already claimed by another receipt of the
 * same user.
 */
public class DuplicateReceiptException extends RuntimeException {

    private final UUID existingReceiptId;
    private final String contentHash;

    public DuplicateReceiptException(String message, UUID existingReceiptId, String contentHash) {
        super(message);
        this.existingReceiptId = existingReceiptId;
        this.contentHash = contentHash;
    }

    public DuplicateReceiptException(String message, UUID existingReceiptId, String contentHash, Throwable cause) {
        super(message, cause);
        this.existingReceiptId = existingReceiptId;
        this.contentHash = contentHash;
    }

    public UUID getExistingReceiptId() {
        return existingReceiptId;
    }

    public String getContentHash() {
        return contentHash;
    }
}
