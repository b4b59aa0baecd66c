package dev.receiptly.processor.ingestion;

import dev.receiptly.processor.concurrent.CancellationSignal;
import dev.receiptly.processor.extraction.ReceiptExtraction;
import dev.receiptly.processor.ocr.OcrAnalysis;
import dev.receiptly.processor.validation.ValidationVerdict;
import dev.receiptly.receipts.Receipt;
import dev.receiptly.storage.ReceiptObjectKeys;
import dev.receiptly.storage.StoredReceiptObject;
import java.io.BufferedInputStream;
import java.io.InputStream;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * State of one ingestion run, filled in step by step.
 */
final class IngestionContext {

    private final UploadRequest request;
    private final UUID receiptId;
    private final Instant startedAt;
    private final ReceiptObjectKeys keys;
    private final CancellationSignal cancellationSignal;
    private final InputStream content;

    private String contentHash;
    private boolean uploadAttempted;
    private StoredReceiptObject storedObject;
    private String quarantineKey;
    private OcrAnalysis analysis;
    private ValidationVerdict verdict;
    private ReceiptExtraction extraction;
    private Receipt receipt;
    private String rawSnapshotKey;
    private String extractedSnapshotKey;

    IngestionContext(UploadRequest request, UUID receiptId, Instant startedAt, CancellationSignal cancellationSignal) {
        this.request = request;
        this.receiptId = receiptId;
        this.startedAt = startedAt;
        this.keys = new ReceiptObjectKeys(request.userId(), LocalDate.ofInstant(startedAt, ZoneOffset.UTC), receiptId);
        this.cancellationSignal = cancellationSignal;
        InputStream source = request.content();
        this.content = source.markSupported() ? source : new BufferedInputStream(source);
    }

    UploadRequest request() {
        return request;
    }

    String userId() {
        return request.userId();
    }

    UUID receiptId() {
        return receiptId;
    }

    Instant startedAt() {
        return startedAt;
    }

    ReceiptObjectKeys keys() {
        return keys;
    }

    CancellationSignal cancellationSignal() {
        return cancellationSignal;
    }

    InputStream content() {
        return content;
    }

    String contentHash() {
        return contentHash;
    }

    void contentHash(String contentHash) {
        this.contentHash = contentHash;
    }

    boolean uploadAttempted() {
        return uploadAttempted;
    }

    void markUploadAttempted() {
        this.uploadAttempted = true;
    }

    StoredReceiptObject storedObject() {
        return storedObject;
    }

    void storedObject(StoredReceiptObject storedObject) {
        this.storedObject = storedObject;
    }

    String originalKey() {
        return storedObject != null ? storedObject.objectKey() : null;
    }

    String quarantineKey() {
        return quarantineKey;
    }

    void quarantineKey(String quarantineKey) {
        this.quarantineKey = quarantineKey;
    }

    OcrAnalysis analysis() {
        return analysis;
    }

    void analysis(OcrAnalysis analysis) {
        this.analysis = analysis;
    }

    ValidationVerdict verdict() {
        return verdict;
    }

    void verdict(ValidationVerdict verdict) {
        this.verdict = verdict;
    }

    ReceiptExtraction extraction() {
        return extraction;
    }

    void extraction(ReceiptExtraction extraction) {
        this.extraction = extraction;
    }

    Receipt receipt() {
        return receipt;
    }

    void receipt(Receipt receipt) {
        this.receipt = receipt;
    }

    String rawSnapshotKey() {
        return rawSnapshotKey;
    }

    void rawSnapshotKey(String rawSnapshotKey) {
        this.rawSnapshotKey = rawSnapshotKey;
    }

    String extractedSnapshotKey() {
        return extractedSnapshotKey;
    }

    void extractedSnapshotKey(String extractedSnapshotKey) {
        this.extractedSnapshotKey = extractedSnapshotKey;
    }
}
