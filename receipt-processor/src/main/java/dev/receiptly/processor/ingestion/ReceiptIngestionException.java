package dev.receiptly.processor.ingestion;

import java.util.UUID;

/**
 * Boundary failure of an ingestion. The message is safe to show to the uploader; details stay in
 * the logs and the stored failure record.
 */
public class ReceiptIngestionException extends RuntimeException {

    private final ReceiptFailureKind kind;
    private final UUID receiptId;

    public ReceiptIngestionException(ReceiptFailureKind kind, String userMessage, UUID receiptId) {
        super(userMessage);
        this.kind = kind;
        this.receiptId = receiptId;
    }

    public ReceiptFailureKind getKind() {
        return kind;
    }

    public UUID getReceiptId() {
        return receiptId;
    }
}
