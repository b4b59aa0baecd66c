package dev.receiptly.processor.ingestion;

import dev.receiptly.receipts.Receipt;
import java.util.Objects;

/**
 * Outcome of a successful ingestion. {@code duplicate} is set when the upload resolved to a
 * receipt the user already owned.
 */
public record IngestionResult(Receipt receipt, boolean duplicate) {

    public IngestionResult {
        Objects.requireNonNull(receipt, "receipt");
    }

    public static IngestionResult created(Receipt receipt) {
        return new IngestionResult(receipt, false);
    }

    public static IngestionResult duplicate(Receipt existing) {
        return new IngestionResult(existing, true);
    }
}
