package dev.receiptly.processor.extraction;

import dev.receiptly.receipts.ReceiptItem;
import dev.receiptly.receipts.ReceiptTotals;
import dev.receiptly.receipts.StoreDetails;
import java.time.LocalDate;
import java.util.List;

/**
 * Typed view of an OCR analysis, ready to be combined with identity and audit data.
 *
 * @param manualReviewReasons why the receipt should be looked at by a person; empty when it looks fine
 * @param skippedItems number of item entries that could not be read
 */
public record ReceiptExtraction(
    StoreDetails store,
    ReceiptTotals totals,
    LocalDate purchaseDate,
    String receiptType,
    String transactionId,
    List<ReceiptItem> items,
    String extractionStrategy,
    List<String> manualReviewReasons,
    int skippedItems
) {

    public ReceiptExtraction {
        items = items != null ? List.copyOf(items) : List.of();
        manualReviewReasons = manualReviewReasons != null ? List.copyOf(manualReviewReasons) : List.of();
    }

    public boolean requiresManualReview() {
        return !manualReviewReasons.isEmpty();
    }
}
