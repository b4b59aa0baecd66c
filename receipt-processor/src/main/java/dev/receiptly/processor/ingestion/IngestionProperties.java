package dev.receiptly.processor.ingestion;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

/**
 * Tuning of the ingestion pipeline.
 *
 * @param poorQualityThreshold validation confidence below which an image is rejected as unreadable
 * @param locationReviewThreshold location confidence below which a receipt is flagged for review
 * @param requiredFields receipt attributes that must be extracted, e.g. {@code total}
 * @param workerThreads size of the pool running asynchronous ingestions
 * @param requestTimeout how long an upload request waits before the ingestion is cancelled
 * @param minUploadSize smallest accepted upload
 * @param maxUploadSize largest accepted upload
 * @param repository {@code firestore} or {@code memory}
 */
@ConfigurationProperties(prefix = "receipt.ingest")
public record IngestionProperties(
    Double poorQualityThreshold,
    Double locationReviewThreshold,
    List<String> requiredFields,
    Integer workerThreads,
    Duration requestTimeout,
    DataSize minUploadSize,
    DataSize maxUploadSize,
    String repository
) {

    public IngestionProperties {
        poorQualityThreshold = poorQualityThreshold != null ? poorQualityThreshold : 0.5;
        locationReviewThreshold = locationReviewThreshold != null ? locationReviewThreshold : 0.5;
        requiredFields = requiredFields != null ? List.copyOf(requiredFields) : List.of();
        workerThreads = workerThreads != null && workerThreads > 0 ? workerThreads : 4;
        requestTimeout = requestTimeout != null ? requestTimeout : Duration.ofMinutes(2);
        minUploadSize = minUploadSize != null ? minUploadSize : DataSize.ofKilobytes(1);
        maxUploadSize = maxUploadSize != null ? maxUploadSize : DataSize.ofMegabytes(10);
        repository = repository != null ? repository : "firestore";
    }
}
