package dev.receiptly.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.HttpMethod;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

@Service
@ConditionalOnBean(Storage.class)
public class GcsReceiptStorageService implements ReceiptStorageService {

    private static final Logger LOGGER = LoggerFactory.getLogger(GcsReceiptStorageService.class);

    static final String CONTENT_HASH_METADATA_KEY = "content-sha256";
    static final String OWNER_METADATA_KEY = "owner-id";
    static final String RECEIPT_ID_METADATA_KEY = "receipt-id";
    static final String FAILURE_REASON_METADATA_KEY = "failure-reason";
    static final String FAILED_AT_METADATA_KEY = "failed-at";
    static final String ORIGINAL_KEY_METADATA_KEY = "original-key";
    private static final String JSON_CONTENT_TYPE = "application/json";
    private static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";
    private static final int MAX_METADATA_VALUE_LENGTH = 1024;

    private final Storage storage;
    private final GcsProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public GcsReceiptStorageService(Storage storage, GcsProperties properties, ObjectMapper objectMapper) {
        this(storage, properties, objectMapper, Clock.systemUTC());
    }

    GcsReceiptStorageService(Storage storage, GcsProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.storage = storage;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
        Assert.isTrue(StringUtils.hasText(properties.getBucket()),
            "gcs.bucket must be configured when Google Cloud Storage is enabled");
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public StoredReceiptObject upload(ReceiptObjectKeys keys, String filename, String contentType, String contentHash,
        InputStream content) {

        Objects.requireNonNull(keys, "keys");
        Objects.requireNonNull(content, "content");
        String objectKey = keys.original(filename);

        Map<String, String> metadata = new HashMap<>();
        metadata.put(OWNER_METADATA_KEY, keys.userId());
        metadata.put(RECEIPT_ID_METADATA_KEY, keys.receiptId().toString());
        if (StringUtils.hasText(contentHash)) {
            metadata.put(CONTENT_HASH_METADATA_KEY, contentHash);
        }

        BlobInfo blobInfo = BlobInfo.newBuilder(BlobId.of(properties.getBucket(), objectKey))
            .setContentType(StringUtils.hasText(contentType) ? contentType : DEFAULT_CONTENT_TYPE)
            .setMetadata(metadata)
            .build();

        try {
            storage.createFrom(blobInfo, content, writeOptions());
            LOGGER.info("Uploaded receipt image to gs://{}/{}", properties.getBucket(), objectKey);
        } catch (IOException | StorageException ex) {
            String displayName = StringUtils.hasText(filename) ? filename : objectKey;
            throw new ReceiptStorageException("Failed to upload file '%s'".formatted(displayName), ex);
        }
        return signedUrl(objectKey, properties.getSignedUrlTtl());
    }

    @Override
    public StoredReceiptObject signedUrl(String objectKey, Duration ttl) {
        Duration resolvedTtl = ttl != null ? ttl : properties.getSignedUrlTtl();
        BlobInfo blobInfo = BlobInfo.newBuilder(BlobId.of(properties.getBucket(), objectKey)).build();
        try {
            URL url = storage.signUrl(blobInfo, resolvedTtl.toSeconds(), TimeUnit.SECONDS,
                Storage.SignUrlOption.withV4Signature(),
                Storage.SignUrlOption.httpMethod(HttpMethod.GET));
            return new StoredReceiptObject(properties.getBucket(), objectKey, url, clock.instant().plus(resolvedTtl));
        } catch (StorageException | IllegalStateException ex) {
            throw new ReceiptStorageException("Unable to sign read URL for '%s'".formatted(objectKey), ex);
        }
    }

    @Override
    public String saveSnapshot(ReceiptObjectKeys keys, SnapshotKind kind, Object payload) {
        String objectKey = keys.snapshot(kind);
        writeJson(objectKey, payload);
        LOGGER.debug("Stored {} snapshot at {}", kind, objectKey);
        return objectKey;
    }

    @Override
    public String quarantine(ReceiptObjectKeys keys, String originalKey, String reason) {
        String quarantineKey = keys.quarantine(originalKey);
        BlobId sourceId = BlobId.of(properties.getBucket(), originalKey);
        BlobId targetId = BlobId.of(properties.getBucket(), quarantineKey);

        try {
            Blob source = storage.get(sourceId);
            if (source == null) {
                if (storage.get(targetId) != null) {
                    LOGGER.info("Receipt {} already quarantined at {}", originalKey, quarantineKey);
                    return quarantineKey;
                }
                throw new ReceiptStorageException("Cannot quarantine missing object '%s'".formatted(originalKey));
            }

            Map<String, String> metadata = new HashMap<>();
            if (source.getMetadata() != null) {
                metadata.putAll(source.getMetadata());
            }
            metadata.put(FAILURE_REASON_METADATA_KEY, truncate(reason));
            metadata.put(FAILED_AT_METADATA_KEY, clock.instant().toString());
            metadata.put(ORIGINAL_KEY_METADATA_KEY, originalKey);

            BlobInfo target = BlobInfo.newBuilder(targetId)
                .setContentType(source.getContentType())
                .setMetadata(metadata)
                .build();

            storage.copy(Storage.CopyRequest.newBuilder()
                .setSource(sourceId)
                .setTarget(target)
                .build()).getResult();
            // a missing source only makes delete() return false
            storage.delete(sourceId);
            LOGGER.warn("Quarantined receipt {} to {}: {}", originalKey, quarantineKey, reason);
            return quarantineKey;
        } catch (StorageException ex) {
            throw new ReceiptStorageException("Failed to quarantine '%s'".formatted(originalKey), ex);
        }
    }

    @Override
    public String saveFailureRecord(ReceiptObjectKeys keys, FailureRecord record) {
        String objectKey = keys.failureRecord();
        writeJson(objectKey, record);
        LOGGER.info("Stored failure record for receipt {} at {}", record.receiptId(), objectKey);
        return objectKey;
    }

    @Override
    public boolean delete(String objectKey) {
        try {
            boolean deleted = storage.delete(BlobId.of(properties.getBucket(), objectKey));
            LOGGER.debug("Delete of {} {}", objectKey, deleted ? "succeeded" : "found nothing");
            return deleted;
        } catch (StorageException ex) {
            throw new ReceiptStorageException("Unable to delete '%s'".formatted(objectKey), ex);
        }
    }

    @Override
    public int deleteAll(ReceiptObjectKeys keys) {
        String prefix = keys.receiptPrefix();
        try {
            Iterable<Blob> blobs = storage.list(properties.getBucket(), Storage.BlobListOption.prefix(prefix))
                .iterateAll();
            List<BlobId> blobIds = new ArrayList<>();
            for (Blob blob : blobs) {
                if (blob.isDirectory()) {
                    continue;
                }
                blobIds.add(blob.getBlobId());
            }
            int deleted = 0;
            for (BlobId blobId : blobIds) {
                if (storage.delete(blobId)) {
                    deleted++;
                }
            }
            LOGGER.info("Deleted {} object(s) under {}", deleted, prefix);
            return deleted;
        } catch (StorageException ex) {
            throw new ReceiptStorageException("Unable to delete objects under '%s'".formatted(prefix), ex);
        }
    }

    private void writeJson(String objectKey, Object payload) {
        byte[] json;
        try {
            json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(payload);
        } catch (JsonProcessingException ex) {
            throw new ReceiptStorageException("Failed to serialize JSON for '%s'".formatted(objectKey), ex);
        }

        BlobInfo blobInfo = BlobInfo.newBuilder(BlobId.of(properties.getBucket(), objectKey))
            .setContentType(JSON_CONTENT_TYPE)
            .build();
        try {
            storage.create(blobInfo, json, targetOptions());
        } catch (StorageException ex) {
            throw new ReceiptStorageException("Failed to write '%s'".formatted(objectKey), ex);
        }
    }

    private Storage.BlobWriteOption[] writeOptions() {
        if (StringUtils.hasText(properties.getKmsKeyName())) {
            return new Storage.BlobWriteOption[] {Storage.BlobWriteOption.kmsKeyName(properties.getKmsKeyName())};
        }
        return new Storage.BlobWriteOption[0];
    }

    private Storage.BlobTargetOption[] targetOptions() {
        if (StringUtils.hasText(properties.getKmsKeyName())) {
            return new Storage.BlobTargetOption[] {Storage.BlobTargetOption.kmsKeyName(properties.getKmsKeyName())};
        }
        return new Storage.BlobTargetOption[0];
    }

    private static String truncate(String value) {
        if (value == null) {
            return "";
        }
        return value.length() <= MAX_METADATA_VALUE_LENGTH ? value : value.substring(0, MAX_METADATA_VALUE_LENGTH);
    }
}
