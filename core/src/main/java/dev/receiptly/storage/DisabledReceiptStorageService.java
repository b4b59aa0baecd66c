package dev.receiptly.storage;

import java.io.InputStream;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnMissingBean(ReceiptStorageService.class)
@ConditionalOnProperty(value = "gcs.enabled", havingValue = "false", matchIfMissing = true)
public class DisabledReceiptStorageService implements ReceiptStorageService {

    private static final String DISABLED_MESSAGE = "Google Cloud Storage integration is disabled";

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public StoredReceiptObject upload(ReceiptObjectKeys keys, String filename, String contentType, String contentHash,
        InputStream content) {
        throw new ReceiptStorageException(DISABLED_MESSAGE);
    }

    @Override
    public StoredReceiptObject signedUrl(String objectKey, Duration ttl) {
        throw new ReceiptStorageException(DISABLED_MESSAGE);
    }

    @Override
    public String saveSnapshot(ReceiptObjectKeys keys, SnapshotKind kind, Object payload) {
        throw new ReceiptStorageException(DISABLED_MESSAGE);
    }

    @Override
    public String quarantine(ReceiptObjectKeys keys, String originalKey, String reason) {
        throw new ReceiptStorageException(DISABLED_MESSAGE);
    }

    @Override
    public String saveFailureRecord(ReceiptObjectKeys keys, FailureRecord record) {
        throw new ReceiptStorageException(DISABLED_MESSAGE);
    }

    @Override
    public boolean delete(String objectKey) {
        throw new ReceiptStorageException(DISABLED_MESSAGE);
    }

    @Override
    public int deleteAll(ReceiptObjectKeys keys) {
        throw new ReceiptStorageException(DISABLED_MESSAGE);
    }
}
