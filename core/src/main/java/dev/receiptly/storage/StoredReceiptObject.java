package dev.receiptly.storage;

import java.net.URL;
import java.time.Instant;
import java.util.Objects;

/**
 * Receipt image stored in Google Cloud Storage together with a time limited read URL.
 */
public record StoredReceiptObject(String bucket, String objectKey, URL signedUrl, Instant signedUrlExpiresAt) {

    public StoredReceiptObject {
        Objects.requireNonNull(bucket, "bucket");
        Objects.requireNonNull(objectKey, "objectKey");
        Objects.requireNonNull(signedUrl, "signedUrl");
    }
}
