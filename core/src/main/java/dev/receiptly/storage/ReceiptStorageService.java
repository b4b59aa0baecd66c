package dev.receiptly.storage;

import java.io.InputStream;
import java.time.Duration;

/**
 * Object store operations used while ingesting a receipt. Keys are always derived from a
 * {@link ReceiptObjectKeys} instance.
 */
public interface ReceiptStorageService {

    boolean isEnabled();

    /**
     * Stores the original image privately and returns a signed read URL for it.
     */
    StoredReceiptObject upload(ReceiptObjectKeys keys, String filename, String contentType, String contentHash,
        InputStream content);

    /**
     * Issues a signed read URL for an existing object.
     */
    StoredReceiptObject signedUrl(String objectKey, Duration ttl);

    /**
     * Serializes the payload as JSON beside the original image.
     *
     * @return the key of the snapshot object
     */
    String saveSnapshot(ReceiptObjectKeys keys, SnapshotKind kind, Object payload);

    /**
     * Moves an uploaded image under the failed-receipts prefix, tagging it with the failure reason.
     * Safe to repeat: a completed move is detected and not redone.
     *
     * @return the quarantine key
     */
    String quarantine(ReceiptObjectKeys keys, String originalKey, String reason);

    /**
     * @return the key of the failure record document
     */
    String saveFailureRecord(ReceiptObjectKeys keys, FailureRecord record);

    /**
     * Deletes a single object.
     *
     * @return {@code false} when the object did not exist
     */
    boolean delete(String objectKey);

    /**
     * Deletes every object stored under the receipt prefix.
     *
     * @return number of deleted objects
     */
    int deleteAll(ReceiptObjectKeys keys);
}
