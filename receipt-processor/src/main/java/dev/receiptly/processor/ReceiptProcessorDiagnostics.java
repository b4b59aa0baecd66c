package dev.receiptly.processor;

import dev.receiptly.processor.ingestion.IngestionProperties;
import dev.receiptly.processor.ocr.OcrProperties;
import dev.receiptly.receipts.ReceiptRepository;
import dev.receiptly.storage.ReceiptStorageService;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Emits diagnostic logging when the service boots so the deployed configuration can be verified.
 */
@Component
public class ReceiptProcessorDiagnostics implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptProcessorDiagnostics.class);

    private final Environment environment;
    private final OcrProperties ocrProperties;
    private final IngestionProperties ingestionProperties;
    private final ReceiptRepository receiptRepository;
    private final ReceiptStorageService receiptStorageService;

    public ReceiptProcessorDiagnostics(Environment environment, OcrProperties ocrProperties,
        IngestionProperties ingestionProperties, ReceiptRepository receiptRepository,
        ReceiptStorageService receiptStorageService) {
        this.environment = environment;
        this.ocrProperties = ocrProperties;
        this.ingestionProperties = ingestionProperties;
        this.receiptRepository = receiptRepository;
        this.receiptStorageService = receiptStorageService;
    }

    @Override
    public void run(ApplicationArguments args) {
        LOGGER.info("Receipt processor diagnostics starting");
        LOGGER.info("Active Spring profiles: {}", Arrays.toString(environment.getActiveProfiles()));
        LOGGER.info("OCR endpoint: {}{} (connect timeout {}, read timeout {})", ocrProperties.baseUrl(),
            ocrProperties.analyzePath(), ocrProperties.connectTimeout(), ocrProperties.readTimeout());
        LOGGER.info("Ingestion settings: poor quality threshold {}, location review threshold {}, "
                + "required fields {}, worker threads {}, request timeout {}",
            ingestionProperties.poorQualityThreshold(), ingestionProperties.locationReviewThreshold(),
            ingestionProperties.requiredFields(), ingestionProperties.workerThreads(),
            ingestionProperties.requestTimeout());
        LOGGER.info("Receipt repository implementation: {}", receiptRepository.getClass().getName());
        if (receiptStorageService.isEnabled()) {
            LOGGER.info("Receipt storage implementation: {}", receiptStorageService.getClass().getName());
        } else {
            LOGGER.warn("Receipt storage is disabled; uploads will be rejected until gcs.enabled=true");
        }
    }
}
