package dev.receiptly.processor.ocr;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "ocr")
public record OcrProperties(
    String baseUrl,
    String analyzePath,
    Duration connectTimeout,
    Duration readTimeout,
    Integer maxRetries,
    Duration initialBackoff,
    Double backoffMultiplier,
    Boolean retryOnNotFound
) {

    public OcrProperties {
        analyzePath = StringUtils.hasText(analyzePath) ? analyzePath : HttpOcrClient.DEFAULT_ANALYZE_PATH;
        connectTimeout = connectTimeout != null ? connectTimeout : Duration.ofSeconds(10);
        readTimeout = readTimeout != null ? readTimeout : Duration.ofSeconds(60);
        maxRetries = maxRetries != null ? maxRetries : OcrRetryPolicy.DEFAULT.maxRetries();
        initialBackoff = initialBackoff != null ? initialBackoff : OcrRetryPolicy.DEFAULT.initialBackoff();
        backoffMultiplier = backoffMultiplier != null ? backoffMultiplier : OcrRetryPolicy.DEFAULT.multiplier();
        retryOnNotFound = retryOnNotFound != null ? retryOnNotFound : OcrRetryPolicy.DEFAULT.retryOnNotFound();
    }

    public OcrRetryPolicy retryPolicy() {
        return new OcrRetryPolicy(maxRetries, initialBackoff, backoffMultiplier, retryOnNotFound);
    }
}
