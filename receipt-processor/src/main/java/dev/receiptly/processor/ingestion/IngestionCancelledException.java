package dev.receiptly.processor.ingestion;

import java.util.UUID;
import java.util.concurrent.CancellationException;

public class IngestionCancelledException extends CancellationException {

    private final UUID receiptId;

    public IngestionCancelledException(UUID receiptId, String message) {
        super(message);
        this.receiptId = receiptId;
    }

    public UUID getReceiptId() {
        return receiptId;
    }
}
