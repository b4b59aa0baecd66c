package dev.receiptly.processor.ocr;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/**
 * Wire format of {@code POST /api/v1/ocr/analyze}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record OcrAnalysisResponse(
    @JsonProperty("success") boolean success,
    @JsonProperty("data") Document data,
    @JsonProperty("validation") OcrValidation validation,
    @JsonProperty("error") String error,
    @JsonProperty("detail") JsonNode detail
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Document(
        @JsonProperty("doc_type") String docType,
        @JsonProperty("fields") JsonNode fields,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("metadata") Map<String, JsonNode> metadata
    ) {
    }

    String failureMessage() {
        if (error != null && !error.isBlank()) {
            return error;
        }
        if (detail != null && !detail.isNull()) {
            return detail.isTextual() ? detail.asText() : detail.toString();
        }
        return "OCR service reported an unsuccessful analysis";
    }
}
