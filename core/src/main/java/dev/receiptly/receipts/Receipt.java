package dev.receiptly.receipts;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Structured receipt aggregate produced by the ingestion pipeline. Items are owned by the
 * receipt and are persisted and deleted together with it.
 */
public record Receipt(
    UUID id,
    String userId,
    String contentHash,
    String originalFileName,
    String objectKey,
    StoreDetails store,
    ReceiptTotals totals,
    LocalDate purchaseDate,
    String receiptType,
    String transactionId,
    List<ReceiptItem> items,
    OcrProvenance provenance,
    ValidationSummary validation,
    ReceiptStatus status,
    boolean requiresManualReview,
    Instant createdAt,
    Instant processedAt,
    Instant updatedAt
) {

    public Receipt {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(contentHash, "contentHash");
        Objects.requireNonNull(status, "status");
        store = store != null ? store : StoreDetails.empty();
        totals = totals != null ? totals : ReceiptTotals.empty();
        items = items != null ? List.copyOf(items) : List.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .userId(userId)
            .contentHash(contentHash)
            .originalFileName(originalFileName)
            .objectKey(objectKey)
            .store(store)
            .totals(totals)
            .purchaseDate(purchaseDate)
            .receiptType(receiptType)
            .transactionId(transactionId)
            .items(items)
            .provenance(provenance)
            .validation(validation)
            .status(status)
            .requiresManualReview(requiresManualReview)
            .createdAt(createdAt)
            .processedAt(processedAt)
            .updatedAt(updatedAt);
    }

    /**
     * Moves the receipt out of {@link ReceiptStatus#PENDING_VALIDATION}.
     *
     * @throws IllegalStateException when the transition is not allowed from the current status
     */
    public Receipt transitionTo(ReceiptStatus target, Instant at) {
        Objects.requireNonNull(target, "target");
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException("Receipt %s cannot move from %s to %s".formatted(id, status, target));
        }
        return toBuilder().status(target).processedAt(at).build();
    }

    public Receipt withUpdatedAt(Instant at) {
        return toBuilder().updatedAt(at).build();
    }

    public static final class Builder {

        private UUID id;
        private String userId;
        private String contentHash;
        private String originalFileName;
        private String objectKey;
        private StoreDetails store;
        private ReceiptTotals totals;
        private LocalDate purchaseDate;
        private String receiptType;
        private String transactionId;
        private List<ReceiptItem> items = new ArrayList<>();
        private OcrProvenance provenance;
        private ValidationSummary validation;
        private ReceiptStatus status = ReceiptStatus.PENDING_VALIDATION;
        private boolean requiresManualReview;
        private Instant createdAt;
        private Instant processedAt;
        private Instant updatedAt;

        private Builder() {
        }

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder contentHash(String contentHash) {
            this.contentHash = contentHash;
            return this;
        }

        public Builder originalFileName(String originalFileName) {
            this.originalFileName = originalFileName;
            return this;
        }

        public Builder objectKey(String objectKey) {
            this.objectKey = objectKey;
            return this;
        }

        public Builder store(StoreDetails store) {
            this.store = store;
            return this;
        }

        public Builder totals(ReceiptTotals totals) {
            this.totals = totals;
            return this;
        }

        public Builder purchaseDate(LocalDate purchaseDate) {
            this.purchaseDate = purchaseDate;
            return this;
        }

        public Builder receiptType(String receiptType) {
            this.receiptType = receiptType;
            return this;
        }

        public Builder transactionId(String transactionId) {
            this.transactionId = transactionId;
            return this;
        }

        public Builder items(List<ReceiptItem> items) {
            this.items = items != null ? new ArrayList<>(items) : new ArrayList<>();
            return this;
        }

        public Builder provenance(OcrProvenance provenance) {
            this.provenance = provenance;
            return this;
        }

        public Builder validation(ValidationSummary validation) {
            this.validation = validation;
            return this;
        }

        public Builder status(ReceiptStatus status) {
            this.status = status;
            return this;
        }

        public Builder requiresManualReview(boolean requiresManualReview) {
            this.requiresManualReview = requiresManualReview;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder processedAt(Instant processedAt) {
            this.processedAt = processedAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Receipt build() {
            return new Receipt(id, userId, contentHash, originalFileName, objectKey, store, totals, purchaseDate,
                receiptType, transactionId, items, provenance, validation, status, requiresManualReview, createdAt,
                processedAt, updatedAt);
        }
    }
}
