package dev.receiptly.processor.ingestion;

import dev.receiptly.hashing.ContentHashGuard;
import dev.receiptly.processor.concurrent.CancellationSignal;
import dev.receiptly.processor.extraction.ReceiptExtraction;
import dev.receiptly.processor.extraction.ReceiptFieldExtractor;
import dev.receiptly.processor.ocr.OcrAnalysis;
import dev.receiptly.processor.ocr.OcrClient;
import dev.receiptly.processor.ocr.OcrProcessingException;
import dev.receiptly.processor.validation.ValidationGate;
import dev.receiptly.processor.validation.ValidationVerdict;
import dev.receiptly.receipts.DuplicateReceiptException;
import dev.receiptly.receipts.OcrProvenance;
import dev.receiptly.receipts.Receipt;
import dev.receiptly.receipts.ReceiptRepository;
import dev.receiptly.receipts.ReceiptStatus;
import dev.receiptly.receipts.ValidationSummary;
import dev.receiptly.storage.FailureRecord;
import dev.receiptly.storage.ReceiptObjectKeys;
import dev.receiptly.storage.ReceiptStorageService;
import dev.receiptly.storage.SnapshotKind;
import dev.receiptly.storage.StoredReceiptObject;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the receipt ingestion pipeline: hash, duplicate lookup, upload, OCR, validation, raw
 * snapshot, extraction, extracted snapshot and persistence.
 *
 * <p>A failure after the upload rolls back completed steps in reverse order, which moves the image
 * to quarantine, and stores a failure record. Callers only see a {@link ReceiptIngestionException}
 * with a user-safe message. A cancelled run removes whatever it uploaded.
 */
public class ReceiptIngestionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptIngestionService.class);

    static final String STEP_HASH = "hash";
    static final String STEP_DUPLICATE_LOOKUP = "duplicate-lookup";
    static final String STEP_UPLOAD = "upload";
    static final String STEP_OCR = "ocr";
    static final String STEP_VALIDATE = "validate";
    static final String STEP_RAW_SNAPSHOT = "raw-snapshot";
    static final String STEP_EXTRACT = "extract";
    static final String STEP_EXTRACTED_SNAPSHOT = "extracted-snapshot";
    static final String STEP_PERSIST = "persist";

    private final ContentHashGuard hashGuard;
    private final ReceiptRepository receiptRepository;
    private final ReceiptStorageService storageService;
    private final OcrClient ocrClient;
    private final ValidationGate validationGate;
    private final ReceiptFieldExtractor fieldExtractor;
    private final Executor executor;
    private final Clock clock;
    private final List<IngestionStep> steps;

    public ReceiptIngestionService(ContentHashGuard hashGuard, ReceiptRepository receiptRepository,
        ReceiptStorageService storageService, OcrClient ocrClient, ValidationGate validationGate,
        ReceiptFieldExtractor fieldExtractor, Executor executor, Clock clock) {

        this.hashGuard = Objects.requireNonNull(hashGuard, "hashGuard");
        this.receiptRepository = Objects.requireNonNull(receiptRepository, "receiptRepository");
        this.storageService = Objects.requireNonNull(storageService, "storageService");
        this.ocrClient = Objects.requireNonNull(ocrClient, "ocrClient");
        this.validationGate = Objects.requireNonNull(validationGate, "validationGate");
        this.fieldExtractor = Objects.requireNonNull(fieldExtractor, "fieldExtractor");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.steps = List.of(
            IngestionStep.of(STEP_HASH, this::computeHash),
            IngestionStep.of(STEP_DUPLICATE_LOOKUP, this::lookupDuplicate),
            IngestionStep.compensated(STEP_UPLOAD, this::upload, this::quarantineUpload),
            IngestionStep.of(STEP_OCR, this::analyze),
            IngestionStep.of(STEP_VALIDATE, this::validate),
            IngestionStep.compensated(STEP_RAW_SNAPSHOT, this::saveRawSnapshot, this::deleteRawSnapshot),
            IngestionStep.of(STEP_EXTRACT, this::extract),
            IngestionStep.compensated(STEP_EXTRACTED_SNAPSHOT, this::saveExtractedSnapshot,
                this::deleteExtractedSnapshot),
            IngestionStep.of(STEP_PERSIST, this::persist));
    }

    List<String> stepNames() {
        return steps.stream().map(IngestionStep::name).toList();
    }

    /**
     * Ingests an upload on the calling thread.
     *
     * @throws ReceiptIngestionException when the upload was rejected or processing failed
     * @throws IngestionCancelledException when the signal fired before the run completed
     */
    public IngestionResult ingest(UploadRequest request, CancellationSignal cancellationSignal) {
        Objects.requireNonNull(request, "request");
        CancellationSignal signal = cancellationSignal != null ? cancellationSignal : CancellationSignal.none();
        IngestionContext context = new IngestionContext(request, UUID.randomUUID(), now(), signal);

        try (ReceiptProcessingMdc.Context ignored = ReceiptProcessingMdc.open(context.receiptId(), request.userId())) {
            LOGGER.info("Starting ingestion of '{}' ({}) as receipt {}", request.originalFileName(),
                request.contentType(), context.receiptId());
            Deque<IngestionStep> completed = new ArrayDeque<>();
            for (IngestionStep step : steps) {
                Optional<IngestionResult> result;
                try {
                    signal.throwIfCancelled(step.name());
                    ReceiptProcessingMdc.setStage(step.name());
                    result = step.action().run(context);
                } catch (CancellationException ex) {
                    throw cancel(context, step, ex);
                } catch (RuntimeException ex) {
                    throw fail(context, step, completed, ex);
                }
                completed.push(step);
                if (result.isPresent()) {
                    IngestionResult ingestionResult = result.get();
                    LOGGER.info("Ingestion finished at step '{}' with receipt {} (duplicate={})", step.name(),
                        ingestionResult.receipt().id(), ingestionResult.duplicate());
                    return ingestionResult;
                }
            }
            throw new IllegalStateException("Ingestion pipeline finished without a result");
        }
    }

    /**
     * Ingests an upload on the ingestion executor. The MDC of the caller is carried over.
     */
    public CompletableFuture<IngestionResult> ingestAsync(UploadRequest request, CancellationSignal cancellationSignal) {
        return CompletableFuture.supplyAsync(() -> ingest(request, cancellationSignal), executor);
    }

    /**
     * Removes a receipt owned by the user together with its stored objects.
     *
     * @return {@code false} when the user owns no such receipt
     */
    public boolean deleteReceipt(String userId, UUID receiptId) {
        Optional<Receipt> receipt = receiptRepository.findById(receiptId)
            .filter(candidate -> candidate.userId().equals(userId));
        if (receipt.isEmpty()) {
            return false;
        }
        Receipt existing = receipt.get();
        Instant createdAt = existing.createdAt() != null ? existing.createdAt() : now();
        ReceiptObjectKeys keys = new ReceiptObjectKeys(userId, LocalDate.ofInstant(createdAt, ZoneOffset.UTC),
            receiptId);
        int deletedObjects = storageService.deleteAll(keys);
        boolean deleted = receiptRepository.delete(receiptId);
        LOGGER.info("Deleted receipt {} for user {} ({} stored object(s))", receiptId, userId, deletedObjects);
        return deleted;
    }

    private Optional<IngestionResult> computeHash(IngestionContext context) {
        String contentHash = hashGuard.computeHash(context.content());
        context.contentHash(contentHash);
        ReceiptProcessingMdc.attachContentHash(contentHash);
        return Optional.empty();
    }

    private Optional<IngestionResult> lookupDuplicate(IngestionContext context) {
        return hashGuard.lookup(context.userId(), context.contentHash()).map(IngestionResult::duplicate);
    }

    private Optional<IngestionResult> upload(IngestionContext context) {
        UploadRequest request = context.request();
        context.markUploadAttempted();
        StoredReceiptObject stored = storageService.upload(context.keys(), request.originalFileName(),
            request.contentType(), context.contentHash(), context.content());
        context.storedObject(stored);
        return Optional.empty();
    }

    private void quarantineUpload(IngestionContext context, String reason) {
        context.quarantineKey(storageService.quarantine(context.keys(), context.originalKey(), reason));
    }

    private Optional<IngestionResult> analyze(IngestionContext context) {
        OcrAnalysis analysis = ocrClient.analyze(context.storedObject().signedUrl().toString(),
            context.cancellationSignal());
        context.analysis(analysis);
        return Optional.empty();
    }

    private Optional<IngestionResult> validate(IngestionContext context) {
        ValidationVerdict verdict = ValidationVerdict.from(context.analysis());
        context.verdict(verdict);
        validationGate.enforce(verdict);
        return Optional.empty();
    }

    private Optional<IngestionResult> saveRawSnapshot(IngestionContext context) {
        context.rawSnapshotKey(storageService.saveSnapshot(context.keys(), SnapshotKind.RAW_RESPONSE,
            context.analysis().response()));
        return Optional.empty();
    }

    private void deleteRawSnapshot(IngestionContext context, String reason) {
        storageService.delete(context.rawSnapshotKey());
    }

    private Optional<IngestionResult> extract(IngestionContext context) {
        ReceiptExtraction extraction = fieldExtractor.extract(context.analysis());
        context.extraction(extraction);
        if (extraction.skippedItems() > 0) {
            LOGGER.warn("Skipped {} unreadable item(s) while extracting receipt {}", extraction.skippedItems(),
                context.receiptId());
        }

        ValidationVerdict verdict = context.verdict();
        Receipt receipt = Receipt.builder()
            .id(context.receiptId())
            .userId(context.userId())
            .contentHash(context.contentHash())
            .originalFileName(context.request().originalFileName())
            .objectKey(context.originalKey())
            .store(extraction.store())
            .totals(extraction.totals())
            .purchaseDate(extraction.purchaseDate())
            .receiptType(extraction.receiptType())
            .transactionId(extraction.transactionId())
            .items(extraction.items())
            .provenance(new OcrProvenance(OcrProvenance.DEFAULT_PROVIDER, context.analysis().confidence(),
                extraction.extractionStrategy()))
            .validation(new ValidationSummary(verdict.validReceipt(), verdict.confidence(), verdict.message()))
            .requiresManualReview(extraction.requiresManualReview())
            .createdAt(context.startedAt())
            .updatedAt(context.startedAt())
            .build()
            .transitionTo(ReceiptStatus.VALIDATED, now());
        context.receipt(receipt);
        return Optional.empty();
    }

    private Optional<IngestionResult> saveExtractedSnapshot(IngestionContext context) {
        context.extractedSnapshotKey(storageService.saveSnapshot(context.keys(), SnapshotKind.EXTRACTED_DATA,
            context.receipt()));
        return Optional.empty();
    }

    private void deleteExtractedSnapshot(IngestionContext context, String reason) {
        storageService.delete(context.extractedSnapshotKey());
    }

    private Optional<IngestionResult> persist(IngestionContext context) {
        try {
            return Optional.of(IngestionResult.created(receiptRepository.create(context.receipt())));
        } catch (DuplicateReceiptException ex) {
            LOGGER.warn("Receipt with hash {} was stored concurrently as {}; discarding upload {}",
                context.contentHash(), ex.getExistingReceiptId(), context.receiptId());
            Receipt existing = findExisting(context, ex).orElseThrow(() -> ex);
            storageService.deleteAll(context.keys());
            return Optional.of(IngestionResult.duplicate(existing));
        }
    }

    private Optional<Receipt> findExisting(IngestionContext context, DuplicateReceiptException ex) {
        if (ex.getExistingReceiptId() != null) {
            Optional<Receipt> existing = receiptRepository.findById(ex.getExistingReceiptId());
            if (existing.isPresent()) {
                return existing;
            }
        }
        return receiptRepository.findByContentHash(context.userId(), context.contentHash());
    }

    private ReceiptIngestionException fail(IngestionContext context, IngestionStep failedStep,
        Deque<IngestionStep> completed, RuntimeException failure) {

        ReceiptFailureKind kind = ReceiptFailureKind.classify(failure);
        String reason = kind.reason(failure);
        LOGGER.error("Ingestion of receipt {} failed at step '{}': {}", context.receiptId(), failedStep.name(), reason,
            failure);

        for (IngestionStep step : completed) {
            if (step.compensation() == null) {
                continue;
            }
            ReceiptProcessingMdc.setStage("compensate-" + step.name());
            try {
                step.compensation().compensate(context, reason);
            } catch (RuntimeException compensationFailure) {
                LOGGER.error("Compensation of step '{}' failed for receipt {}", step.name(), context.receiptId(),
                    compensationFailure);
            }
        }

        if (context.uploadAttempted()) {
            writeFailureRecord(context, reason, failure);
        }
        return new ReceiptIngestionException(kind, kind.userMessage(failure), context.receiptId());
    }

    private void writeFailureRecord(IngestionContext context, String reason, RuntimeException failure) {
        FailureRecord record = new FailureRecord(
            context.receiptId(),
            context.userId(),
            reason,
            now(),
            context.originalKey(),
            context.quarantineKey(),
            ocrResponse(context, failure),
            FailureRecord.ExceptionSummary.of(failure));
        try {
            storageService.saveFailureRecord(context.keys(), record);
        } catch (RuntimeException ex) {
            LOGGER.error("Failed to store failure record for receipt {}", context.receiptId(), ex);
        }
    }

    private static String ocrResponse(IngestionContext context, RuntimeException failure) {
        if (context.analysis() != null) {
            return context.analysis().response().toString();
        }
        if (failure instanceof OcrProcessingException ocrFailure) {
            return ocrFailure.getRawResponse();
        }
        return null;
    }

    private IngestionCancelledException cancel(IngestionContext context, IngestionStep step,
        CancellationException cause) {

        LOGGER.info("Ingestion of receipt {} cancelled at step '{}'", context.receiptId(), step.name());
        if (context.uploadAttempted()) {
            try {
                int deleted = storageService.deleteAll(context.keys());
                LOGGER.info("Removed {} object(s) of cancelled receipt {}", deleted, context.receiptId());
            } catch (RuntimeException ex) {
                LOGGER.warn("Could not remove objects of cancelled receipt {}", context.receiptId(), ex);
            }
        }
        IngestionCancelledException cancelled = new IngestionCancelledException(context.receiptId(),
            "Ingestion of receipt %s was cancelled before step '%s'".formatted(context.receiptId(), step.name()));
        cancelled.initCause(cause);
        return cancelled;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }
}
