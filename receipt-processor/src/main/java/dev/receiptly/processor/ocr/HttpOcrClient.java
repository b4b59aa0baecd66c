package dev.receiptly.processor.ocr;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.receiptly.processor.concurrent.CancellationSignal;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Calls the OCR analysis endpoint, retrying server errors, connection failures and (when the
 * policy allows it) 404 responses returned while a freshly uploaded object is not yet readable.
 */
public class HttpOcrClient implements OcrClient {

    public static final String DEFAULT_ANALYZE_PATH = "/api/v1/ocr/analyze";

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpOcrClient.class);

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String analyzePath;
    private final OcrRetryPolicy retryPolicy;
    private final Retry retry;
    private final ObservationRegistry observationRegistry;

    public HttpOcrClient(RestClient restClient, ObjectMapper objectMapper, String analyzePath,
        OcrRetryPolicy retryPolicy, ObservationRegistry observationRegistry) {

        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.analyzePath = StringUtils.hasText(analyzePath) ? analyzePath : DEFAULT_ANALYZE_PATH;
        this.retryPolicy = retryPolicy != null ? retryPolicy : OcrRetryPolicy.DEFAULT;
        this.observationRegistry = observationRegistry != null ? observationRegistry : ObservationRegistry.NOOP;
        this.retry = Retry.of("ocr", retryConfig(this.retryPolicy));
        this.retry.getEventPublisher().onRetry(event -> LOGGER.warn(
            "OCR attempt {} failed ({}); retrying in {} ms", event.getNumberOfRetryAttempts(),
            event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown",
            event.getWaitInterval().toMillis()));
    }

    static RetryConfig retryConfig(OcrRetryPolicy policy) {
        return RetryConfig.custom()
            .maxAttempts(policy.maxAttempts())
            .intervalFunction(backoff(policy))
            .retryOnException(TransientOcrFailure.class::isInstance)
            .build();
    }

    /**
     * Wait before retry {@code n} (1-based): the initial backoff times multiplier^(n-1).
     */
    static IntervalFunction backoff(OcrRetryPolicy policy) {
        return IntervalFunction.ofExponentialBackoff(policy.initialBackoff().toMillis(), policy.multiplier());
    }

    public OcrRetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    @Override
    public OcrAnalysis analyze(String imageUrl, CancellationSignal cancellationSignal) {
        if (!StringUtils.hasText(imageUrl)) {
            throw new IllegalArgumentException("Image URL must not be empty");
        }
        CancellationSignal signal = cancellationSignal != null ? cancellationSignal : CancellationSignal.none();
        AtomicInteger attempts = new AtomicInteger();

        Observation observation = Observation.start("receipt.ocr.analyze", observationRegistry)
            .lowCardinalityKeyValue("path", analyzePath);
        try (Observation.Scope scope = observation.openScope()) {
            String body = Retry.decorateSupplier(retry, () -> {
                signal.throwIfCancelled("OCR attempt " + (attempts.get() + 1));
                return executeAttempt(imageUrl, attempts.incrementAndGet());
            }).get();
            observation.highCardinalityKeyValue("attempts", String.valueOf(attempts.get()));
            return toAnalysis(body);
        } catch (TransientOcrFailure ex) {
            OcrProcessingException failure = new OcrProcessingException(
                "OCR service failed after %d attempt(s): %s".formatted(attempts.get(), ex.getMessage()),
                ex.httpStatus, ex.rawResponse, ex.getCause());
            observation.error(failure);
            throw failure;
        } catch (RuntimeException ex) {
            observation.error(ex);
            throw ex;
        } finally {
            observation.stop();
        }
    }

    private String executeAttempt(String imageUrl, int attempt) {
        LOGGER.info("Calling OCR service {} (attempt {}/{})", analyzePath, attempt, retryPolicy.maxAttempts());
        try {
            String body = restClient.post()
                .uri(analyzePath)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(Map.of("image_url", imageUrl))
                .retrieve()
                .body(String.class);
            return body != null ? body : "";
        } catch (HttpServerErrorException ex) {
            throw new TransientOcrFailure("HTTP " + ex.getStatusCode().value(), ex.getStatusCode().value(),
                ex.getResponseBodyAsString(), ex);
        } catch (RestClientResponseException ex) {
            int status = ex.getStatusCode().value();
            if (status == HttpStatus.NOT_FOUND.value() && retryPolicy.retryOnNotFound()) {
                throw new TransientOcrFailure("HTTP 404", status, ex.getResponseBodyAsString(), ex);
            }
            if (status == HttpStatus.REQUEST_TIMEOUT.value() || status == HttpStatus.TOO_MANY_REQUESTS.value()) {
                throw new TransientOcrFailure("HTTP " + status, status, ex.getResponseBodyAsString(), ex);
            }
            throw new OcrProcessingException("OCR service rejected the request with HTTP " + status, status,
                ex.getResponseBodyAsString(), ex);
        } catch (ResourceAccessException ex) {
            throw new TransientOcrFailure("I/O error: " + ex.getMessage(), null, null, ex);
        } catch (RestClientException ex) {
            throw new OcrProcessingException("OCR request failed", null, null, ex);
        }
    }

    private OcrAnalysis toAnalysis(String body) {
        JsonNode document;
        OcrAnalysisResponse response;
        try {
            document = objectMapper.readTree(body);
            response = objectMapper.treeToValue(document, OcrAnalysisResponse.class);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            throw new OcrProcessingException("OCR response could not be decoded", HttpStatus.OK.value(), body, ex);
        }
        if (response == null || !response.success()) {
            String message = response != null ? response.failureMessage() : "OCR service returned an empty body";
            throw new OcrProcessingException(message, HttpStatus.OK.value(), body);
        }
        OcrAnalysisResponse.Document data = response.data();
        if (data == null) {
            throw new OcrProcessingException("OCR response did not contain any data", HttpStatus.OK.value(), body);
        }
        double confidence = data.confidence() != null ? data.confidence() : 0.0;
        LOGGER.info("OCR analysis succeeded: docType={}, confidence={}, validation={}", data.docType(), confidence,
            response.validation() != null ? response.validation().validReceipt() : "(absent)");
        return new OcrAnalysis(data.docType(), FieldNodeReader.readFields(data.fields()), confidence,
            data.metadata(), response.validation(), document);
    }

    private static final class TransientOcrFailure extends RuntimeException {

        private final Integer httpStatus;
        private final String rawResponse;

        private TransientOcrFailure(String message, Integer httpStatus, String rawResponse, Throwable cause) {
            super(message, cause);
            this.httpStatus = httpStatus;
            this.rawResponse = rawResponse;
        }
    }
}
