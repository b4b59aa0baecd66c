package dev.receiptly.processor.ocr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.ExpectedCount.times;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withResourceNotFound;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.receiptly.processor.concurrent.CancellationSignal;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.observation.ObservationRegistry;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class HttpOcrClientTest {

    private static final String ANALYZE_URL = "http://ocr.test/api/v1/ocr/analyze";
    private static final String IMAGE_URL = "https://storage.test/bucket/users/u/receipt.jpg?sig=1";
    private static final String SUCCESS_BODY = """
        {
          "success": true,
          "data": {
            "doc_type": "receipt",
            "confidence": 0.91,
            "fields": {
              "MerchantName": {"value": "Corner Market", "value_type": "string", "confidence": 0.97,
                               "source": "azure", "requires_manual_review": false}
            },
            "metadata": {"postal_code": "12345", "tesseract_confidence": 0.8}
          },
          "validation": {"is_valid_receipt": true, "confidence": 0.9, "message": "ok", "doc_type": "receipt"}
        }
        """;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private MockRestServiceServer server;
    private RestClient.Builder restClientBuilder;

    @BeforeEach
    void setUp() {
        restClientBuilder = RestClient.builder();
        server = MockRestServiceServer.bindTo(restClientBuilder).build();
        restClientBuilder.baseUrl("http://ocr.test");
    }

    @Test
    void parsesSuccessfulAnalysis() {
        server.expect(once(), requestTo(ANALYZE_URL))
            .andExpect(method(HttpMethod.POST))
            .andExpect(content().json("{\"image_url\": \"" + IMAGE_URL + "\"}"))
            .andRespond(withSuccess(SUCCESS_BODY, MediaType.APPLICATION_JSON));

        OcrAnalysis analysis = client(fastPolicy(true)).analyze(IMAGE_URL, CancellationSignal.none());

        assertThat(analysis.docType()).isEqualTo("receipt");
        assertThat(analysis.confidence()).isEqualTo(0.91);
        assertThat(analysis.validation().validReceipt()).isTrue();
        assertThat(analysis.metadata().get("postal_code").asText()).isEqualTo("12345");
        assertThat(analysis.fields().get("MerchantName")).isInstanceOfSatisfying(ScalarField.class, field -> {
            assertThat(field.value().asText()).isEqualTo("Corner Market");
            assertThat(field.source()).isEqualTo("azure");
        });
        assertThat(analysis.response().path("data").path("doc_type").asText()).isEqualTo("receipt");
        server.verify();
    }

    @Test
    void retriesServerErrorsUntilSuccess() {
        server.expect(times(2), requestTo(ANALYZE_URL)).andRespond(withServerError());
        server.expect(once(), requestTo(ANALYZE_URL)).andRespond(withSuccess(SUCCESS_BODY, MediaType.APPLICATION_JSON));

        OcrAnalysis analysis = client(fastPolicy(true)).analyze(IMAGE_URL, CancellationSignal.none());

        assertThat(analysis.fields()).containsKey("MerchantName");
        server.verify();
    }

    @Test
    void retriesNotFoundWhileUploadIsNotYetReadable() {
        server.expect(once(), requestTo(ANALYZE_URL)).andRespond(withResourceNotFound());
        server.expect(once(), requestTo(ANALYZE_URL)).andRespond(withSuccess(SUCCESS_BODY, MediaType.APPLICATION_JSON));

        client(fastPolicy(true)).analyze(IMAGE_URL, CancellationSignal.none());

        server.verify();
    }

    @Test
    void retriesConnectionFailures() {
        server.expect(once(), requestTo(ANALYZE_URL)).andRespond(withException(new SocketTimeoutException("timeout")));
        server.expect(once(), requestTo(ANALYZE_URL)).andRespond(withSuccess(SUCCESS_BODY, MediaType.APPLICATION_JSON));

        client(fastPolicy(true)).analyze(IMAGE_URL, CancellationSignal.none());

        server.verify();
    }

    @Test
    void notFoundFailsImmediatelyWhenRetryIsDisabled() {
        server.expect(once(), requestTo(ANALYZE_URL)).andRespond(withResourceNotFound().body("missing"));

        assertThatThrownBy(() -> client(fastPolicy(false)).analyze(IMAGE_URL, CancellationSignal.none()))
            .isInstanceOfSatisfying(OcrProcessingException.class,
                ex -> assertThat(ex.getHttpStatus()).isEqualTo(404));
        server.verify();
    }

    @Test
    void clientErrorsAreNotRetried() {
        server.expect(once(), requestTo(ANALYZE_URL))
            .andRespond(withBadRequest().body("{\"detail\":\"image_url missing\"}").contentType(MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client(fastPolicy(true)).analyze(IMAGE_URL, CancellationSignal.none()))
            .isInstanceOfSatisfying(OcrProcessingException.class, ex -> {
                assertThat(ex.getHttpStatus()).isEqualTo(400);
                assertThat(ex.getRawResponse()).contains("image_url missing");
            });
        server.verify();
    }

    @Test
    void tooManyRequestsIsRetried() {
        server.expect(once(), requestTo(ANALYZE_URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
        server.expect(once(), requestTo(ANALYZE_URL)).andRespond(withSuccess(SUCCESS_BODY, MediaType.APPLICATION_JSON));

        client(fastPolicy(true)).analyze(IMAGE_URL, CancellationSignal.none());

        server.verify();
    }

    @Test
    void givesUpAfterConfiguredRetries() {
        server.expect(times(4), requestTo(ANALYZE_URL))
            .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE).body("busy"));

        assertThatThrownBy(() -> client(fastPolicy(true)).analyze(IMAGE_URL, CancellationSignal.none()))
            .isInstanceOfSatisfying(OcrProcessingException.class, ex -> {
                assertThat(ex.getMessage()).contains("after 4 attempt(s)");
                assertThat(ex.getHttpStatus()).isEqualTo(503);
                assertThat(ex.getRawResponse()).isEqualTo("busy");
            });
        server.verify();
    }

    @Test
    void defaultPolicyMakesFourAttemptsWaitingTwoFourAndEightSeconds() {
        IntervalFunction backoff = HttpOcrClient.backoff(OcrRetryPolicy.DEFAULT);

        assertThat(HttpOcrClient.retryConfig(OcrRetryPolicy.DEFAULT).getMaxAttempts()).isEqualTo(4);
        assertThat(backoff.apply(1)).isEqualTo(2000L);
        assertThat(backoff.apply(2)).isEqualTo(4000L);
        assertThat(backoff.apply(3)).isEqualTo(8000L);
    }

    @Test
    void onlyTransientFailuresAreRetried() {
        RetryConfig config = HttpOcrClient.retryConfig(OcrRetryPolicy.DEFAULT);

        assertThat(config.getExceptionPredicate()
            .test(new OcrProcessingException("bad request", 400, "{}"))).isFalse();
    }

    @Test
    void unsuccessfulAnalysisIsReportedWithoutRetry() {
        String body = "{\"success\": false, \"error\": \"Unable to read image\"}";
        server.expect(once(), requestTo(ANALYZE_URL)).andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client(fastPolicy(true)).analyze(IMAGE_URL, CancellationSignal.none()))
            .isInstanceOfSatisfying(OcrProcessingException.class, ex -> {
                assertThat(ex.getMessage()).isEqualTo("Unable to read image");
                assertThat(ex.getHttpStatus()).isEqualTo(200);
                assertThat(ex.getRawResponse()).isEqualTo(body);
            });
        server.verify();
    }

    @Test
    void malformedBodyIsReported() {
        server.expect(once(), requestTo(ANALYZE_URL)).andRespond(withSuccess("<html>oops</html>", MediaType.TEXT_HTML));

        assertThatThrownBy(() -> client(fastPolicy(true)).analyze(IMAGE_URL, CancellationSignal.none()))
            .isInstanceOf(OcrProcessingException.class)
            .hasMessageContaining("could not be decoded");
    }

    @Test
    void missingValidationBlockIsAllowed() {
        String body = "{\"success\": true, \"data\": {\"doc_type\": \"receipt\", \"confidence\": 0.7, \"fields\": {}}}";
        server.expect(once(), requestTo(ANALYZE_URL)).andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

        OcrAnalysis analysis = client(fastPolicy(true)).analyze(IMAGE_URL, CancellationSignal.none());

        assertThat(analysis.validation()).isNull();
        assertThat(analysis.confidence()).isEqualTo(0.7);
        assertThat(analysis.fields()).isEmpty();
    }

    @Test
    void cancelledSignalPreventsCall() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();

        assertThatThrownBy(() -> client(fastPolicy(true)).analyze(IMAGE_URL, signal))
            .isInstanceOf(CancellationException.class);
        server.verify();
    }

    @Test
    void rejectsBlankImageUrl() {
        assertThatThrownBy(() -> client(fastPolicy(true)).analyze(" ", CancellationSignal.none()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private HttpOcrClient client(OcrRetryPolicy policy) {
        return new HttpOcrClient(restClientBuilder.build(), objectMapper, null, policy, ObservationRegistry.create());
    }

    private static OcrRetryPolicy fastPolicy(boolean retryOnNotFound) {
        return new OcrRetryPolicy(3, Duration.ofMillis(5), 2.0, retryOnNotFound);
    }
}
