package dev.receiptly.processor.api;

import dev.receiptly.processor.concurrent.CancellationSignal;
import dev.receiptly.processor.ingestion.IngestionCancelledException;
import dev.receiptly.processor.ingestion.IngestionProperties;
import dev.receiptly.processor.ingestion.IngestionResult;
import dev.receiptly.processor.ingestion.ReceiptIngestionException;
import dev.receiptly.processor.ingestion.ReceiptIngestionService;
import dev.receiptly.processor.ingestion.UploadRequest;
import dev.receiptly.receipts.Receipt;
import dev.receiptly.receipts.ReceiptRepository;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

/**
 * REST API for uploading receipt images and reading back the structured receipts. Uploads run on
 * the ingestion executor; a request that outlives the configured timeout cancels its ingestion.
 */
@RestController
@RequestMapping(path = "/api/receipts")
public class ReceiptController {

    public static final String USER_ID_HEADER = "X-User-Id";
    static final int CLIENT_CLOSED_REQUEST = 499;

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptController.class);

    private final ReceiptIngestionService ingestionService;
    private final ReceiptRepository receiptRepository;
    private final ReceiptFileValidator fileValidator;
    private final Duration requestTimeout;

    @Autowired
    public ReceiptController(ReceiptIngestionService ingestionService, ReceiptRepository receiptRepository,
        ReceiptFileValidator fileValidator, IngestionProperties ingestionProperties) {
        this(ingestionService, receiptRepository, fileValidator, ingestionProperties.requestTimeout());
    }

    ReceiptController(ReceiptIngestionService ingestionService, ReceiptRepository receiptRepository,
        ReceiptFileValidator fileValidator, Duration requestTimeout) {
        this.ingestionService = ingestionService;
        this.receiptRepository = receiptRepository;
        this.fileValidator = fileValidator;
        this.requestTimeout = requestTimeout;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public CompletableFuture<ResponseEntity<ReceiptResponse>> upload(@RequestHeader(USER_ID_HEADER) String userId,
        @RequestPart("file") MultipartFile file) throws IOException {

        if (file == null || file.isEmpty()) {
            throw new InvalidUploadException("A non-empty image must be provided as the 'file' part");
        }
        byte[] content = file.getBytes();
        ReceiptImageFormat format = fileValidator.validate(content);
        String fileName = StringUtils.hasText(file.getOriginalFilename()) ? file.getOriginalFilename() : null;
        LOGGER.info("Accepted {} upload '{}' ({} bytes) for user {}", format, fileName, content.length, userId);

        CancellationSignal signal = new CancellationSignal();
        UploadRequest request = new UploadRequest(userId, fileName, format.contentType(),
            new ByteArrayInputStream(content));
        return ingestionService.ingestAsync(request, signal)
            .orTimeout(requestTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .whenComplete((result, failure) -> {
                if (failure instanceof TimeoutException) {
                    LOGGER.warn("Ingestion for user {} exceeded {}; cancelling", userId, requestTimeout);
                    signal.cancel();
                }
            })
            .thenApply(ReceiptController::toResponse);
    }

    @GetMapping(path = "/{receiptId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ReceiptResponse getReceipt(@RequestHeader(USER_ID_HEADER) String userId,
        @PathVariable("receiptId") UUID receiptId) {

        Receipt receipt = receiptRepository.findById(receiptId)
            .filter(candidate -> candidate.userId().equals(userId))
            .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Receipt not found"));
        return ReceiptResponse.from(receipt, false);
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<ReceiptResponse> listReceipts(@RequestHeader(USER_ID_HEADER) String userId) {
        return receiptRepository.findByUser(userId).stream()
            .map(receipt -> ReceiptResponse.from(receipt, false))
            .toList();
    }

    @DeleteMapping(path = "/{receiptId}")
    public ResponseEntity<Void> deleteReceipt(@RequestHeader(USER_ID_HEADER) String userId,
        @PathVariable("receiptId") UUID receiptId) {

        if (!ingestionService.deleteReceipt(userId, receiptId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Receipt not found");
        }
        return ResponseEntity.noContent().build();
    }

    @ExceptionHandler(InvalidUploadException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidUpload(InvalidUploadException exception) {
        LOGGER.info("Rejected upload: {}", exception.getMessage());
        return Map.of("error", exception.getMessage());
    }

    @ExceptionHandler(ReceiptIngestionException.class)
    public ResponseEntity<Map<String, Object>> handleIngestionFailure(ReceiptIngestionException exception) {
        HttpStatus status = switch (exception.getKind()) {
            case INVALID_RECEIPT, POOR_IMAGE_QUALITY, MISSING_REQUIRED_FIELDS -> HttpStatus.UNPROCESSABLE_ENTITY;
            case OCR_PROCESSING -> HttpStatus.BAD_GATEWAY;
            case UNEXPECTED -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        LOGGER.warn("Ingestion of receipt {} failed ({}): {}", exception.getReceiptId(), exception.getKind(),
            exception.getMessage());
        return ResponseEntity.status(status)
            .body(Map.of("error", exception.getMessage(), "kind", exception.getKind().name()));
    }

    @ExceptionHandler(IngestionCancelledException.class)
    public ResponseEntity<Map<String, Object>> handleCancelled(IngestionCancelledException exception) {
        LOGGER.info("Ingestion of receipt {} was cancelled", exception.getReceiptId());
        return ResponseEntity.status(CLIENT_CLOSED_REQUEST).body(Map.of("error", "Receipt processing was cancelled"));
    }

    @ExceptionHandler(TimeoutException.class)
    @ResponseStatus(HttpStatus.GATEWAY_TIMEOUT)
    public Map<String, Object> handleTimeout(TimeoutException exception) {
        return Map.of("error", "Receipt processing took too long and was cancelled. Please try again.");
    }

    private static ResponseEntity<ReceiptResponse> toResponse(IngestionResult result) {
        HttpStatus status = result.duplicate() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(ReceiptResponse.from(result.receipt(), result.duplicate()));
    }
}
