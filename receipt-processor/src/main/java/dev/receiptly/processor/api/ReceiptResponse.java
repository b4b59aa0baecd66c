package dev.receiptly.processor.api;

import dev.receiptly.receipts.OcrProvenance;
import dev.receiptly.receipts.Receipt;
import dev.receiptly.receipts.ReceiptItem;
import dev.receiptly.receipts.ReceiptStatus;
import dev.receiptly.receipts.ReceiptTotals;
import dev.receiptly.receipts.StoreDetails;
import dev.receiptly.receipts.ValidationSummary;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * JSON view of a receipt returned by the upload API.
 */
public record ReceiptResponse(
    UUID id,
    String userId,
    String contentHash,
    String originalFileName,
    ReceiptStatus status,
    StoreDetails store,
    ReceiptTotals totals,
    LocalDate purchaseDate,
    String receiptType,
    String transactionId,
    List<ReceiptItem> items,
    OcrProvenance provenance,
    ValidationSummary validation,
    boolean requiresManualReview,
    Instant createdAt,
    Instant processedAt,
    Instant updatedAt,
    boolean duplicate
) {

    static ReceiptResponse from(Receipt receipt, boolean duplicate) {
        return new ReceiptResponse(receipt.id(), receipt.userId(), receipt.contentHash(), receipt.originalFileName(),
            receipt.status(), receipt.store(), receipt.totals(), receipt.purchaseDate(), receipt.receiptType(),
            receipt.transactionId(), receipt.items(), receipt.provenance(), receipt.validation(),
            receipt.requiresManualReview(), receipt.createdAt(), receipt.processedAt(), receipt.updatedAt(), duplicate);
    }
}
