package dev.receiptly.processor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreOptions;
import dev.receiptly.hashing.ContentHashGuard;
import dev.receiptly.processor.api.ReceiptFileValidator;
import dev.receiptly.processor.concurrent.MdcPropagatingExecutor;
import dev.receiptly.processor.extraction.ReceiptFieldExtractor;
import dev.receiptly.processor.extraction.RequiredField;
import dev.receiptly.processor.ingestion.IngestionProperties;
import dev.receiptly.processor.ingestion.ReceiptIngestionService;
import dev.receiptly.processor.ocr.HttpOcrClient;
import dev.receiptly.processor.ocr.OcrClient;
import dev.receiptly.processor.ocr.OcrProperties;
import dev.receiptly.processor.persistence.FirestoreReceiptRepository;
import dev.receiptly.processor.validation.ValidationGate;
import dev.receiptly.receipts.InMemoryReceiptRepository;
import dev.receiptly.receipts.ReceiptRepository;
import dev.receiptly.storage.ReceiptStorageService;
import io.micrometer.observation.ObservationRegistry;
import java.time.Clock;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.ClientHttpRequestFactories;
import org.springframework.boot.web.client.ClientHttpRequestFactorySettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

/**
 * Service configuration for the receipt ingestion workload.
 */
@Configuration
public class ReceiptProcessingConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptProcessingConfiguration.class);

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public OcrClient ocrClient(OcrProperties ocrProperties, ObjectMapper objectMapper,
        ObjectProvider<ObservationRegistry> observationRegistry) {

        if (!StringUtils.hasText(ocrProperties.baseUrl())) {
            throw new IllegalStateException("OCR service base URL must be configured (ocr.base-url)");
        }
        ClientHttpRequestFactorySettings requestFactorySettings = ClientHttpRequestFactorySettings.DEFAULTS
            .withConnectTimeout(ocrProperties.connectTimeout())
            .withReadTimeout(ocrProperties.readTimeout());
        RestClient restClient = RestClient.builder()
            .baseUrl(ocrProperties.baseUrl())
            .requestFactory(ClientHttpRequestFactories.get(requestFactorySettings))
            .build();

        HttpOcrClient client = new HttpOcrClient(restClient, objectMapper, ocrProperties.analyzePath(),
            ocrProperties.retryPolicy(), observationRegistry.getIfAvailable(() -> ObservationRegistry.NOOP));
        LOGGER.info("OCR client targets {}{} with retry policy {}", ocrProperties.baseUrl(),
            ocrProperties.analyzePath(), client.getRetryPolicy());
        return client;
    }

    @Bean
    @ConditionalOnProperty(value = "receipt.ingest.repository", havingValue = "firestore", matchIfMissing = true)
    public ReceiptProcessingSettings receiptProcessingSettings() {
        return ReceiptProcessingSettings.fromEnvironment();
    }

    @Bean
    @ConditionalOnProperty(value = "receipt.ingest.repository", havingValue = "firestore", matchIfMissing = true)
    public Firestore firestore(ReceiptProcessingSettings receiptProcessingSettings) {
        FirestoreOptions.Builder optionsBuilder = FirestoreOptions.getDefaultInstance().toBuilder();
        if (StringUtils.hasText(receiptProcessingSettings.projectId())) {
            optionsBuilder.setProjectId(receiptProcessingSettings.projectId());
        }
        optionsBuilder.setDatabaseId(receiptProcessingSettings.databaseId());
        Firestore firestore = optionsBuilder.build().getService();
        LOGGER.info("Initialized Firestore client for project '{}' database '{}' (target collection '{}')",
            firestore.getOptions().getProjectId(), receiptProcessingSettings.databaseId(),
            receiptProcessingSettings.receiptsCollection());
        return firestore;
    }

    @Bean
    @ConditionalOnProperty(value = "receipt.ingest.repository", havingValue = "firestore", matchIfMissing = true)
    public ReceiptRepository firestoreReceiptRepository(Firestore firestore,
        ReceiptProcessingSettings receiptProcessingSettings, Clock clock) {
        return new FirestoreReceiptRepository(firestore, receiptProcessingSettings.receiptsCollection(),
            receiptProcessingSettings.receiptItemsCollection(), receiptProcessingSettings.receiptHashesCollection(),
            clock);
    }

    @Bean
    @ConditionalOnProperty(value = "receipt.ingest.repository", havingValue = "memory")
    public ReceiptRepository inMemoryReceiptRepository(Clock clock) {
        LOGGER.warn("Receipts are kept in memory and will be lost on restart");
        return new InMemoryReceiptRepository(clock);
    }

    @Bean
    public ContentHashGuard contentHashGuard(ReceiptRepository receiptRepository) {
        return new ContentHashGuard(receiptRepository);
    }

    @Bean
    public ValidationGate validationGate(IngestionProperties ingestionProperties) {
        return new ValidationGate(ingestionProperties.poorQualityThreshold());
    }

    @Bean
    public ReceiptFieldExtractor receiptFieldExtractor(IngestionProperties ingestionProperties) {
        Set<RequiredField> requiredFields = EnumSet.noneOf(RequiredField.class);
        for (String name : ingestionProperties.requiredFields()) {
            if (StringUtils.hasText(name)) {
                requiredFields.add(RequiredField.fromPropertyName(name));
            }
        }
        LOGGER.info("Receipt extraction requires fields {} (location review threshold {})", requiredFields,
            ingestionProperties.locationReviewThreshold());
        return new ReceiptFieldExtractor(ingestionProperties.locationReviewThreshold(), requiredFields);
    }

    @Bean
    public ReceiptFileValidator receiptFileValidator(IngestionProperties ingestionProperties) {
        return new ReceiptFileValidator(ingestionProperties.minUploadSize(), ingestionProperties.maxUploadSize());
    }

    @Bean(destroyMethod = "shutdown")
    public MdcPropagatingExecutor receiptIngestionExecutor(IngestionProperties ingestionProperties) {
        AtomicInteger threadCounter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "receipt-ingest-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return new MdcPropagatingExecutor(
            Executors.newFixedThreadPool(ingestionProperties.workerThreads(), threadFactory));
    }

    @Bean
    public ReceiptIngestionService receiptIngestionService(ContentHashGuard contentHashGuard,
        ReceiptRepository receiptRepository, ReceiptStorageService receiptStorageService, OcrClient ocrClient,
        ValidationGate validationGate, ReceiptFieldExtractor receiptFieldExtractor,
        MdcPropagatingExecutor receiptIngestionExecutor, Clock clock) {

        return new ReceiptIngestionService(contentHashGuard, receiptRepository, receiptStorageService, ocrClient,
            validationGate, receiptFieldExtractor, receiptIngestionExecutor, clock);
    }
}
