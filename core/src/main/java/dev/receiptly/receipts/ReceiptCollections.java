package dev.receiptly.receipts;

/**
 * Shared constants describing the Firestore layout used for receipts and their indexes.
 */
public final class ReceiptCollections {

    /**
     * Default Firestore collection containing receipt documents.
     */
    public static final String DEFAULT_RECEIPTS_COLLECTION = "receipts";

    /**
     * Default Firestore collection containing receipt line items, keyed by receipt id and index.
     */
    public static final String DEFAULT_RECEIPT_ITEMS_COLLECTION = "receiptItems";

    /**
     * Default Firestore collection holding one create-only claim per user and content hash.
     */
    public static final String DEFAULT_RECEIPT_HASHES_COLLECTION = "receiptHashes";

    private ReceiptCollections() {
    }
}
