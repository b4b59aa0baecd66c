package dev.receiptly.receipts;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence port for receipt aggregates. Implementations store items together with their
 * receipt and enforce at most one receipt per user and content hash.
 */
public interface ReceiptRepository {

    /**
     * Stores a new receipt.
     *
     * @throws DuplicateReceiptException when the user already owns a receipt with the same content hash
     */
    Receipt create(Receipt receipt);

    Optional<Receipt> findById(UUID id);

    Optional<Receipt> findByContentHash(String userId, String contentHash);

    /**
     * Receipts owned by the user, newest first.
     */
    List<Receipt> findByUser(String userId);

    /**
     * Replaces a stored receipt and stamps its {@code updatedAt}.
     *
     * @throws IllegalArgumentException when no receipt with the same id exists
     */
    Receipt update(Receipt receipt);

    /**
     * Deletes a receipt together with its items.
     *
     * @return {@code true} when a receipt was removed
     */
    boolean delete(UUID id);
}
